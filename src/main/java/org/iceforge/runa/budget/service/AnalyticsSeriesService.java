package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.config.AnalyticsProperties;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.AnalyticsSeries;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.PeriodAmount;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.model.YearRange;
import org.iceforge.runa.budget.repository.AnalyticsSeriesRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized time series at the filter frequency.
 */
@Service
public class AnalyticsSeriesService {

    private final AnalyticsSeriesRepository repository;
    private final TransformationPipeline pipeline;
    private final UseCaseSupport support;
    private final AnalyticsProperties props;

    public AnalyticsSeriesService(AnalyticsSeriesRepository repository,
                                  TransformationPipeline pipeline,
                                  UseCaseSupport support,
                                  AnalyticsProperties props) {
        this.repository = Objects.requireNonNull(repository);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.support = Objects.requireNonNull(support);
        this.props = Objects.requireNonNull(props);
    }

    public Mono<AnalyticsResult<AnalyticsSeries>> getSeries(AnalyticsFilter filter,
                                                            TransformationOptions options,
                                                            boolean periodGrowth) {
        Optional<AnalyticsError> invalid = UseCaseSupport.validate(filter);
        if (invalid.isPresent()) {
            return Mono.just(AnalyticsResult.err(invalid.get()));
        }
        Frequency frequency = filter.frequency();
        String unit = unit(options, periodGrowth, props.getReferenceYear());

        return support.fetch("Analytics series query", () -> repository.getSeries(filter))
                .flatMap(fetched -> UseCaseSupport.then(fetched, data -> {
                    if (data.points().isEmpty()) {
                        return Mono.just(AnalyticsResult.ok(new AnalyticsSeries(frequency, unit, List.of())));
                    }
                    return support.normalize(frequency, yearRange(data.points()),
                            factors -> new AnalyticsSeries(frequency, unit, pipeline.transformSeries(
                                    data.points(), frequency, data.population(), factors, options, periodGrowth)));
                }));
    }

    /**
     * Axis unit for the series values, e.g. {@code EUR/capita (real 2024)}.
     */
    static String unit(TransformationOptions options, boolean periodGrowth, int referenceYear) {
        if (periodGrowth) return "%";
        if (options.percentGdp()) return "% of GDP";
        return options.currency().name()
                + (options.perCapita() ? "/capita" : "")
                + (options.inflationAdjusted() ? " (real " + referenceYear + ")" : "");
    }

    private static YearRange yearRange(List<PeriodAmount> points) {
        int min = points.stream().mapToInt(PeriodAmount::year).min().getAsInt();
        int max = points.stream().mapToInt(PeriodAmount::year).max().getAsInt();
        return new YearRange(min, max);
    }
}
