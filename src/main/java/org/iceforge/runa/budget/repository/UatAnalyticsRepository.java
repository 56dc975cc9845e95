package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.HeatmapUatDataPoint;
import reactor.core.publisher.Mono;

import java.util.List;

public interface UatAnalyticsRepository {

    /**
     * Raw RON totals, one row per UAT and year, ordered by UAT id then year.
     */
    Mono<List<HeatmapUatDataPoint>> getHeatmapData(AnalyticsFilter filter);
}
