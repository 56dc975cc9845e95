package org.iceforge.runa.budget.service;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an {@link AnalyticsError}.
 */
public final class AnalyticsResult<T> {

    private final T value;
    private final AnalyticsError error;

    private AnalyticsResult(T value, AnalyticsError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AnalyticsResult<T> ok(T value) {
        return new AnalyticsResult<>(Objects.requireNonNull(value), null);
    }

    public static <T> AnalyticsResult<T> err(AnalyticsError error) {
        return new AnalyticsResult<>(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Result is an error: " + error);
        }
        return value;
    }

    public AnalyticsError getError() {
        if (error == null) {
            throw new NoSuchElementException("Result is ok");
        }
        return error;
    }

    public <R> AnalyticsResult<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : err(error);
    }
}
