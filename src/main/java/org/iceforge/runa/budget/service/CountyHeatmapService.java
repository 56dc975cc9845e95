package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.CountyHeatmapPoint;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.HeatmapCountyDataPoint;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.repository.CountyAnalyticsRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.iceforge.runa.budget.service.UseCaseSupport.toDouble;

@Service
public class CountyHeatmapService {

    private final CountyAnalyticsRepository repository;
    private final TransformationPipeline pipeline;
    private final UseCaseSupport support;

    public CountyHeatmapService(CountyAnalyticsRepository repository,
                                TransformationPipeline pipeline,
                                UseCaseSupport support) {
        this.repository = Objects.requireNonNull(repository);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.support = Objects.requireNonNull(support);
    }

    /**
     * One point per county. With {@code percentGdp} the amount is the county total as a share of
     * national GDP over the same years, in nominal RON.
     */
    public Mono<AnalyticsResult<List<CountyHeatmapPoint>>> getHeatmapData(AnalyticsFilter filter,
                                                                          TransformationOptions options) {
        Optional<AnalyticsError> invalid = UseCaseSupport.validate(filter);
        if (invalid.isPresent()) {
            return Mono.just(AnalyticsResult.err(invalid.get()));
        }

        return support.fetch("County heatmap query", () -> repository.getHeatmapData(filter))
                .flatMap(fetched -> UseCaseSupport.then(fetched, rows -> {
                    if (rows.isEmpty()) {
                        return Mono.just(AnalyticsResult.ok(List.<CountyHeatmapPoint>of()));
                    }
                    return support.normalize(Frequency.YEAR, UseCaseSupport.yearRange(rows),
                            factors -> pipeline.aggregate(rows, factors, options).stream()
                                    .map(CountyHeatmapService::toPoint)
                                    .toList());
                }));
    }

    private static CountyHeatmapPoint toPoint(NormalizedTotal<HeatmapCountyDataPoint> total) {
        HeatmapCountyDataPoint row = total.last();
        return new CountyHeatmapPoint(
                row.countyCode(),
                row.countyName(),
                row.countyPopulation(),
                row.countyEntityCui(),
                toDouble(total.amount()),
                toDouble(total.totalAmount()),
                toDouble(total.perCapitaAmount()));
    }
}
