package org.iceforge.runa.budget.web;

import org.iceforge.runa.budget.service.AnalyticsError;

import java.util.Objects;

/**
 * Carries a failed {@link org.iceforge.runa.budget.service.AnalyticsResult} to the controller's
 * exception handler.
 */
public class AnalyticsRequestException extends RuntimeException {

    private final AnalyticsError error;

    public AnalyticsRequestException(AnalyticsError error) {
        super(Objects.requireNonNull(error).getMessage(), error.getCause());
        this.error = error;
    }

    public AnalyticsError getError() {
        return error;
    }
}
