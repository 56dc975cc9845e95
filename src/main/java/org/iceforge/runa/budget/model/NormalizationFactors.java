package org.iceforge.runa.budget.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Normalization factors keyed by period label ({@code 2024}, {@code 2024-03}, {@code 2024-Q1}).
 */
public record NormalizationFactors(Map<String, BigDecimal> cpi,
                                   Map<String, BigDecimal> eur,
                                   Map<String, BigDecimal> usd,
                                   Map<String, BigDecimal> gdp,
                                   Map<String, BigDecimal> population) {

    public NormalizationFactors {
        cpi = Map.copyOf(Objects.requireNonNull(cpi, "cpi"));
        eur = Map.copyOf(Objects.requireNonNull(eur, "eur"));
        usd = Map.copyOf(Objects.requireNonNull(usd, "usd"));
        gdp = Map.copyOf(Objects.requireNonNull(gdp, "gdp"));
        population = Map.copyOf(Objects.requireNonNull(population, "population"));
    }

    /**
     * RON exchange rate map for the target currency, or null for RON.
     */
    public Map<String, BigDecimal> rates(Currency currency) {
        return switch (currency) {
            case EUR -> eur;
            case USD -> usd;
            case RON -> null;
        };
    }
}
