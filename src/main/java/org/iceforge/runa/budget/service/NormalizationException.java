package org.iceforge.runa.budget.service;

/**
 * Thrown when normalization factors are missing or unusable for a period that has data.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
