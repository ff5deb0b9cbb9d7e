package com.example.catalog.task;

/**
 * Cache key of one task invocation: the task name plus a SHA-256 digest over
 * the task name and its normalized arguments.
 */
public record Fingerprint(String task, String digest) {

    @Override
    public String toString() {
        return task + ":" + digest.substring(0, Math.min(12, digest.length()));
    }
}
