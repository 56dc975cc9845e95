package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Currency;
import org.iceforge.runa.budget.model.NormalizationMode;
import org.iceforge.runa.budget.model.TransformationOptions;

/**
 * Maps the caller-facing normalization settings onto {@link TransformationOptions}.
 *
 * Request-level values win over the same fields nested in the filter. The legacy
 * {@code total_euro} and {@code per_capita_euro} modes force EUR; {@code percent_gdp} works on
 * nominal RON and drops inflation and currency.
 */
public final class NormalizationOptionsResolver {

    private NormalizationOptionsResolver() {
    }

    public static TransformationOptions resolve(AnalyticsFilter filter,
                                                NormalizationMode normalization,
                                                Currency currency,
                                                Boolean inflationAdjusted) {
        NormalizationMode mode = firstNonNull(normalization, filter == null ? null : filter.getNormalization(), NormalizationMode.TOTAL);
        Currency requested = firstNonNull(currency, filter == null ? null : filter.getCurrency(), Currency.RON);
        boolean inflation = firstNonNull(inflationAdjusted, filter == null ? null : filter.getInflationAdjusted(), Boolean.FALSE);

        if (mode == NormalizationMode.PERCENT_GDP) {
            return new TransformationOptions(false, Currency.RON, false, true);
        }
        Currency effective = mode.isLegacyEuro() ? Currency.EUR : requested;
        return new TransformationOptions(inflation, effective, mode.isPerCapita(), false);
    }

    public static boolean periodGrowth(AnalyticsFilter filter, Boolean showPeriodGrowth) {
        return firstNonNull(showPeriodGrowth, filter == null ? null : filter.getShowPeriodGrowth(), Boolean.FALSE);
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) return first;
        return second != null ? second : fallback;
    }
}
