package org.iceforge.runa.budget.service;

import java.util.Objects;

/**
 * Failure of an analytics use case. Carried as a value in {@link AnalyticsResult}; never thrown.
 */
public final class AnalyticsError {

    public enum Kind {
        MISSING_REQUIRED_FILTER,
        DATABASE_ERROR,
        TIMEOUT_ERROR,
        NORMALIZATION_ERROR
    }

    private final Kind kind;
    private final String message;
    private final String field;
    private final boolean retryable;
    private final Throwable cause;

    private AnalyticsError(Kind kind, String message, String field, boolean retryable, Throwable cause) {
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
        this.field = field;
        this.retryable = retryable;
        this.cause = cause;
    }

    public static AnalyticsError missingRequiredFilter(String field) {
        return new AnalyticsError(Kind.MISSING_REQUIRED_FILTER,
                "Missing required filter: " + field, field, false, null);
    }

    public static AnalyticsError database(String message, Throwable cause) {
        return new AnalyticsError(Kind.DATABASE_ERROR, message, null, true, cause);
    }

    public static AnalyticsError timeout(String message, Throwable cause) {
        return new AnalyticsError(Kind.TIMEOUT_ERROR, message, null, true, cause);
    }

    public static AnalyticsError normalization(String message, Throwable cause) {
        return new AnalyticsError(Kind.NORMALIZATION_ERROR, message, null, false, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /** Name of the missing filter field; null for other kinds. */
    public String getField() {
        return field;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
