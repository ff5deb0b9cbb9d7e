package com.example.catalog.extract;

import java.util.Objects;

/**
 * Outcome of reading one field from a product page.
 *
 * <ul>
 *   <li>{@code PRESENT}: the field was read and cleaned.</li>
 *   <li>{@code ABSENT}: optional content was missing; recorded as null.</li>
 *   <li>{@code FAILED}: a mandatory field could not be read; the record
 *       cannot be built.</li>
 * </ul>
 */
public final class FieldResult<T> {

    public enum Status { PRESENT, ABSENT, FAILED }

    private final String field;
    private final Status status;
    private final T value;
    private final String reason;

    private FieldResult(String field, Status status, T value, String reason) {
        this.field = Objects.requireNonNull(field);
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> FieldResult<T> present(String field, T value) {
        return new FieldResult<>(field, Status.PRESENT, value, null);
    }

    public static <T> FieldResult<T> absent(String field, String reason) {
        return new FieldResult<>(field, Status.ABSENT, null, reason);
    }

    public static <T> FieldResult<T> failed(String field, String reason) {
        return new FieldResult<>(field, Status.FAILED, null, reason);
    }

    public String field() { return field; }

    public Status status() { return status; }

    public boolean isFailed() { return status == Status.FAILED; }

    /** The value, or null when absent or failed. */
    public T valueOrNull() { return value; }

    public String reason() { return reason; }

    @Override
    public String toString() {
        return switch (status) {
            case PRESENT -> field + "=" + value;
            case ABSENT -> field + " absent (" + reason + ")";
            case FAILED -> field + " failed (" + reason + ")";
        };
    }
}
