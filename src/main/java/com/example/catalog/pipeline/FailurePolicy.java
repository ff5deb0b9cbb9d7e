package com.example.catalog.pipeline;

/**
 * What a run does once a stage has settled with failed units.
 */
public enum FailurePolicy {
    /** Fail the run; nothing is written. */
    ABORT,
    /** Drop the failed units, log them and carry on. */
    SKIP
}
