package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.NormalizationFactors;
import org.iceforge.runa.budget.model.YearRange;
import org.iceforge.runa.budget.model.YearlyAmount;
import org.iceforge.runa.budget.normalization.NormalizationFactorProvider;
import org.iceforge.runa.budget.repository.DatabaseErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Steps shared by the aggregation use cases: validate, fetch, generate factors, transform.
 * Each step turns failures into an {@link AnalyticsError} of its own kind.
 */
@Component
public class UseCaseSupport {

    private static final Logger log = LoggerFactory.getLogger(UseCaseSupport.class);

    private final NormalizationFactorProvider factorProvider;

    public UseCaseSupport(NormalizationFactorProvider factorProvider) {
        this.factorProvider = Objects.requireNonNull(factorProvider);
    }

    /**
     * {@code report_type} is optional on the filter model but every aggregation needs it.
     */
    public static Optional<AnalyticsError> validate(AnalyticsFilter filter) {
        if (filter.getReportType() == null || filter.getReportType().isBlank()) {
            return Optional.of(AnalyticsError.missingRequiredFilter("report_type"));
        }
        return Optional.empty();
    }

    /**
     * Subscribes to the publisher {@code source} supplies. Anything it throws or signals becomes a
     * classified database or timeout error.
     */
    public <T> Mono<AnalyticsResult<T>> fetch(String operation, Supplier<Mono<T>> source) {
        return Mono.defer(source)
                .map(AnalyticsResult::ok)
                .onErrorResume(e -> {
                    AnalyticsError error = DatabaseErrors.classify(operation, e);
                    log.warn("{}: {}", operation, error.getMessage());
                    return Mono.just(AnalyticsResult.err(error));
                });
    }

    /**
     * Generates factors once for {@code years} and applies {@code transform}. Provider failures and
     * {@link NormalizationException}s raised by the transform become normalization errors.
     */
    public <T> Mono<AnalyticsResult<T>> normalize(Frequency frequency,
                                                  YearRange years,
                                                  Function<NormalizationFactors, T> transform) {
        return Mono.defer(() -> factorProvider.generateFactors(frequency, years.startYear(), years.endYear()))
                .switchIfEmpty(Mono.error(() -> new NormalizationException("Provider returned no factors")))
                .onErrorMap(e -> !(e instanceof NormalizationException),
                        e -> new NormalizationException("Failed to generate normalization factors: " + e.getMessage(), e))
                .map(factors -> AnalyticsResult.ok(transform.apply(factors)))
                .onErrorResume(NormalizationException.class, e -> {
                    log.warn("Normalization failed for {} {}-{}: {}", frequency, years.startYear(), years.endYear(), e.getMessage());
                    return Mono.just(AnalyticsResult.err(AnalyticsError.normalization(e.getMessage(), e)));
                });
    }

    public static <T, R> Mono<AnalyticsResult<R>> then(AnalyticsResult<T> result,
                                                       Function<T, Mono<AnalyticsResult<R>>> next) {
        return result.isOk() ? next.apply(result.getValue()) : Mono.just(AnalyticsResult.err(result.getError()));
    }

    /**
     * Smallest and largest year present in {@code rows}. Must not be called with no rows.
     */
    public static YearRange yearRange(Collection<? extends YearlyAmount> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("No rows to take a year range from");
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (YearlyAmount row : rows) {
            min = Math.min(min, row.year());
            max = Math.max(max, row.year());
        }
        return new YearRange(min, max);
    }

    static double toDouble(BigDecimal value) {
        return value == null ? 0d : value.doubleValue();
    }
}
