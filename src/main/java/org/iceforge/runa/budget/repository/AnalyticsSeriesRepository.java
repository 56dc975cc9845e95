package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.SeriesData;
import reactor.core.publisher.Mono;

public interface AnalyticsSeriesRepository {

    /**
     * Raw RON totals per period at the filter frequency, plus the population of the filtered
     * area (null when it cannot be resolved).
     */
    Mono<SeriesData> getSeries(AnalyticsFilter filter);
}
