package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.Currency;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.NormalizationFactors;
import org.iceforge.runa.budget.model.PeriodAmount;
import org.iceforge.runa.budget.model.SeriesPoint;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.model.YearlyAmount;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies monetary transformations to raw amounts in a fixed order:
 * inflation, currency, cross-year aggregation, per-capita.
 *
 * All arithmetic stays in {@link BigDecimal}; callers convert to double when building output.
 */
@Component
public class TransformationPipeline {

    static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Normalizes every row for its own year, then sums per entity. Entities keep the order in
     * which they first appear in {@code rows}.
     *
     * @throws NormalizationException when a required factor is missing or zero for a row's year
     */
    public <T extends YearlyAmount> List<NormalizedTotal<T>> aggregate(List<T> rows,
                                                                       NormalizationFactors factors,
                                                                       TransformationOptions options) {
        Map<Object, Accumulator<T>> byEntity = new LinkedHashMap<>();

        for (T row : rows) {
            String label = String.valueOf(row.year());
            BigDecimal raw = row.totalAmount() == null ? BigDecimal.ZERO : row.totalAmount();

            Accumulator<T> acc = byEntity.computeIfAbsent(row.entityKey(), k -> new Accumulator<>());
            acc.last = row;

            if (options.percentGdp()) {
                acc.total = acc.total.add(raw);
                acc.gdp = acc.gdp.add(requirePresent(factors.gdp(), label, "gdp"));
            } else {
                acc.total = acc.total.add(normalize(raw, label, factors, options));
            }
        }

        List<NormalizedTotal<T>> out = new ArrayList<>(byEntity.size());
        for (Accumulator<T> acc : byEntity.values()) {
            BigDecimal perCapita = perCapita(acc.total, acc.last.population());
            BigDecimal amount;
            if (options.percentGdp()) {
                amount = acc.gdp.signum() == 0
                        ? BigDecimal.ZERO
                        : acc.total.divide(acc.gdp, MC).multiply(HUNDRED, MC);
            } else {
                amount = options.perCapita() ? perCapita : acc.total;
            }
            out.add(new NormalizedTotal<>(acc.last, acc.total, perCapita, amount));
        }
        return out;
    }

    /**
     * Inflation then currency for one amount at one period label.
     */
    public BigDecimal normalize(BigDecimal amount,
                                String label,
                                NormalizationFactors factors,
                                TransformationOptions options) {
        BigDecimal value = amount;
        if (options.inflationAdjusted()) {
            value = value.multiply(requireFactor(factors.cpi(), label, "cpi"), MC);
        }
        if (options.currency() != Currency.RON) {
            BigDecimal rate = requireFactor(factors.rates(options.currency()), label,
                    options.currency().name().toLowerCase(Locale.ROOT));
            value = value.divide(rate, MC);
        }
        return value;
    }

    /**
     * Transforms a raw series point by point. Per-capita divides by {@code population}, falling back
     * to the factor population of each period; percent-of-GDP divides each point by the period's GDP.
     * Growth, when requested, is applied last and compares each point with the previous period label.
     */
    public List<SeriesPoint> transformSeries(List<PeriodAmount> points,
                                             Frequency frequency,
                                             Long population,
                                             NormalizationFactors factors,
                                             TransformationOptions options,
                                             boolean periodGrowth) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (PeriodAmount p : points) {
            String label = PeriodParser.formatLabel(p.year(), p.subPeriod(), frequency);
            BigDecimal raw = p.amount() == null ? BigDecimal.ZERO : p.amount();
            BigDecimal value;
            if (options.percentGdp()) {
                BigDecimal gdp = factors.gdp().get(label);
                value = gdp == null || gdp.signum() == 0
                        ? BigDecimal.ZERO
                        : raw.divide(gdp, MC).multiply(HUNDRED, MC);
            } else {
                value = normalize(raw, label, factors, options);
                if (options.perCapita()) {
                    value = perCapita(value, seriesPopulation(population, factors, label));
                }
            }
            values.merge(label, value, BigDecimal::add);
        }

        List<String> ordered = new ArrayList<>(values.keySet());
        ordered.sort(null);

        List<SeriesPoint> out = new ArrayList<>(ordered.size());
        for (String label : ordered) {
            BigDecimal value = values.get(label);
            if (periodGrowth) {
                value = growth(value, PeriodParser.previousLabel(label, frequency).map(values::get).orElse(null));
            }
            out.add(new SeriesPoint(label, value.doubleValue()));
        }
        return out;
    }

    static BigDecimal perCapita(BigDecimal total, Long population) {
        if (population == null || population <= 0) return BigDecimal.ZERO;
        return total.divide(BigDecimal.valueOf(population), MC);
    }

    static BigDecimal growth(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) return BigDecimal.ZERO;
        return current.subtract(previous).divide(previous, MC).multiply(HUNDRED, MC);
    }

    private static Long seriesPopulation(Long population, NormalizationFactors factors, String label) {
        if (population != null && population > 0) return population;
        BigDecimal fromFactors = factors.population().get(label);
        return fromFactors == null ? null : fromFactors.longValue();
    }

    private static BigDecimal requirePresent(Map<String, BigDecimal> map, String label, String dimension) {
        BigDecimal factor = map == null ? null : map.get(label);
        if (factor == null) {
            throw new NormalizationException("No " + dimension + " factor for period " + label);
        }
        return factor;
    }

    private static BigDecimal requireFactor(Map<String, BigDecimal> map, String label, String dimension) {
        BigDecimal factor = requirePresent(map, label, dimension);
        if (factor.signum() == 0) {
            throw new NormalizationException("Zero " + dimension + " factor for period " + label);
        }
        return factor;
    }

    private static final class Accumulator<T> {
        T last;
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal gdp = BigDecimal.ZERO;
    }
}
