package org.iceforge.runa.budget.normalization;

import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.ParsedPeriod;
import org.iceforge.runa.budget.service.PeriodParser;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Expands a {@link FactorSeries} into a complete map for one frequency and year range.
 *
 * Each label resolves to, in order: the value at the requested frequency, the yearly value of
 * its year, the value of the previous label. The first label is seeded with the latest value
 * before the range. Labels with no value at all are left out.
 */
public final class FactorMaps {

    private FactorMaps() {
    }

    public static Map<String, BigDecimal> generate(Frequency frequency,
                                                   int startYear,
                                                   int endYear,
                                                   FactorSeries series) {
        Map<String, BigDecimal> direct = directValues(frequency, series);
        BigDecimal previous = latestBefore(direct, frequency, startYear);
        if (previous == null && frequency != Frequency.YEAR) {
            previous = latestBefore(series.getYearly(), Frequency.YEAR, startYear);
        }

        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (String label : PeriodParser.labels(startYear, endYear, frequency)) {
            BigDecimal value = direct.get(label);
            if (value == null && frequency != Frequency.YEAR) {
                value = series.getYearly().get(label.substring(0, 4));
            }
            if (value == null) {
                value = previous;
            }
            if (value != null) {
                out.put(label, value);
                previous = value;
            }
        }
        return out;
    }

    private static Map<String, BigDecimal> directValues(Frequency frequency, FactorSeries series) {
        return switch (frequency) {
            case MONTH -> series.getMonthly();
            case QUARTER -> series.getQuarterly();
            case YEAR -> series.getYearly();
        };
    }

    /**
     * Value of the latest label strictly before January (or Q1) of {@code startYear}.
     */
    private static BigDecimal latestBefore(Map<String, BigDecimal> values, Frequency frequency, int startYear) {
        int boundary = ordinal(startYear, 1, frequency);
        int best = Integer.MIN_VALUE;
        BigDecimal bestValue = null;
        for (Map.Entry<String, BigDecimal> e : values.entrySet()) {
            OptionalInt idx = index(e.getKey(), frequency);
            if (idx.isEmpty() || idx.getAsInt() >= boundary) continue;
            if (idx.getAsInt() > best) {
                best = idx.getAsInt();
                bestValue = e.getValue();
            }
        }
        return bestValue;
    }

    private static OptionalInt index(String label, Frequency frequency) {
        if (frequency == Frequency.YEAR && label.length() != 4) return OptionalInt.empty();
        Optional<ParsedPeriod> parsed = PeriodParser.parse(label, frequency);
        if (parsed.isEmpty()) return OptionalInt.empty();
        return OptionalInt.of(ordinal(parsed.get().year(), parsed.get().subPeriod(), frequency));
    }

    private static int ordinal(int year, int subPeriod, Frequency frequency) {
        return switch (frequency) {
            case MONTH -> year * 12 + subPeriod;
            case QUARTER -> year * 4 + subPeriod;
            case YEAR -> year;
        };
    }
}
