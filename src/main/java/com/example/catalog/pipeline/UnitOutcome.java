package com.example.catalog.pipeline;

/**
 * Result slot of one fan-out unit: either a value or the failure that ended it.
 */
public record UnitOutcome<I, O>(I input, O value, Throwable failure) {

    public static <I, O> UnitOutcome<I, O> success(I input, O value) {
        return new UnitOutcome<>(input, value, null);
    }

    public static <I, O> UnitOutcome<I, O> failure(I input, Throwable failure) {
        return new UnitOutcome<>(input, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
