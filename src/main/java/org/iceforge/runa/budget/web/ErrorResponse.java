package org.iceforge.runa.budget.web;

import java.time.Instant;

public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String detail;
    private final boolean retryable;

    public ErrorResponse(String error, String detail, boolean retryable) {
        this.error = error;
        this.detail = detail;
        this.retryable = retryable;
    }

    public ErrorResponse(String error, String detail) {
        this(error, detail, false);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
