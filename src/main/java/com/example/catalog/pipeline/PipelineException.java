package com.example.catalog.pipeline;

import java.util.List;

/**
 * A stage ended with failed units under {@link FailurePolicy#ABORT}.
 */
public class PipelineException extends RuntimeException {

    private final String stage;
    private final List<UnitFailure> failures;

    public PipelineException(String stage, List<UnitFailure> failures) {
        super(failures.size() + " unit(s) failed in stage '" + stage + "', first: "
                + (failures.isEmpty() ? "-" : failures.get(0).input() + " (" + failures.get(0).message() + ")"));
        this.stage = stage;
        this.failures = List.copyOf(failures);
    }

    public String getStage() {
        return stage;
    }

    public List<UnitFailure> getFailures() {
        return failures;
    }
}
