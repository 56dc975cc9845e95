package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.HeatmapCountyDataPoint;
import reactor.core.publisher.Mono;

import java.util.List;

public interface CountyAnalyticsRepository {

    /**
     * Raw RON totals, one row per county and year, ordered by county code then year.
     */
    Mono<List<HeatmapCountyDataPoint>> getHeatmapData(AnalyticsFilter filter);
}
