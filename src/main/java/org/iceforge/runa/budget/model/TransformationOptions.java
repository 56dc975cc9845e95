package org.iceforge.runa.budget.model;

import java.util.Objects;

/**
 * Monetary transformations applied to raw amounts, in the fixed order inflation, currency,
 * aggregation, per-capita. {@code percentGdp} replaces the first two steps with a share of GDP.
 */
public record TransformationOptions(boolean inflationAdjusted,
                                    Currency currency,
                                    boolean perCapita,
                                    boolean percentGdp) {

    public TransformationOptions {
        Objects.requireNonNull(currency, "currency");
    }

    public TransformationOptions(boolean inflationAdjusted, Currency currency, boolean perCapita) {
        this(inflationAdjusted, currency, perCapita, false);
    }

    public static TransformationOptions defaults() {
        return new TransformationOptions(false, Currency.RON, false, false);
    }
}
