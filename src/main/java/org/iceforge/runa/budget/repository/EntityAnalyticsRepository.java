package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.EntityYearAmount;
import reactor.core.publisher.Mono;

import java.util.List;

public interface EntityAnalyticsRepository {

    /**
     * Raw RON totals, one row per entity and year. Aggregate thresholds are not applied here:
     * they compare against the normalized cross-year total.
     */
    Mono<List<EntityYearAmount>> getYearlyAmounts(AnalyticsFilter filter);
}
