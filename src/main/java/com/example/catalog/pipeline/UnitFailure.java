package com.example.catalog.pipeline;

public record UnitFailure(String stage, String input, String message) {

    static UnitFailure of(String stage, UnitOutcome<?, ?> outcome) {
        Throwable failure = outcome.failure();
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new UnitFailure(stage, String.valueOf(outcome.input()), message);
    }
}
