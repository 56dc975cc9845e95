package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.HeatmapUatDataPoint;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.model.UatHeatmapPoint;
import org.iceforge.runa.budget.repository.UatAnalyticsRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.iceforge.runa.budget.service.UseCaseSupport.toDouble;

@Service
public class UatHeatmapService {

    private final UatAnalyticsRepository repository;
    private final TransformationPipeline pipeline;
    private final UseCaseSupport support;

    public UatHeatmapService(UatAnalyticsRepository repository,
                             TransformationPipeline pipeline,
                             UseCaseSupport support) {
        this.repository = Objects.requireNonNull(repository);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.support = Objects.requireNonNull(support);
    }

    /**
     * One point per UAT: yearly rows are normalized per year, then summed across years.
     * Percent-of-GDP is not offered at UAT level and is ignored here.
     */
    public Mono<AnalyticsResult<List<UatHeatmapPoint>>> getHeatmapData(AnalyticsFilter filter,
                                                                       TransformationOptions options) {
        Optional<AnalyticsError> invalid = UseCaseSupport.validate(filter);
        if (invalid.isPresent()) {
            return Mono.just(AnalyticsResult.err(invalid.get()));
        }
        TransformationOptions effective = new TransformationOptions(
                options.inflationAdjusted(), options.currency(), options.perCapita(), false);

        return support.fetch("UAT heatmap query", () -> repository.getHeatmapData(filter))
                .flatMap(fetched -> UseCaseSupport.then(fetched, rows -> {
                    if (rows.isEmpty()) {
                        return Mono.just(AnalyticsResult.ok(List.<UatHeatmapPoint>of()));
                    }
                    return support.normalize(Frequency.YEAR, UseCaseSupport.yearRange(rows),
                            factors -> pipeline.aggregate(rows, factors, effective).stream()
                                    .map(UatHeatmapService::toPoint)
                                    .toList());
                }));
    }

    private static UatHeatmapPoint toPoint(NormalizedTotal<HeatmapUatDataPoint> total) {
        HeatmapUatDataPoint row = total.last();
        return new UatHeatmapPoint(
                row.uatId(),
                row.uatCode(),
                row.uatName(),
                row.sirutaCode(),
                row.countyCode(),
                row.countyName(),
                row.region(),
                row.population(),
                toDouble(total.amount()),
                toDouble(total.totalAmount()),
                toDouble(total.perCapitaAmount()));
    }
}
