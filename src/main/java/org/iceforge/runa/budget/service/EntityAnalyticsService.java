package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.config.AnalyticsProperties;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.EntityAnalyticsPage;
import org.iceforge.runa.budget.model.EntityAnalyticsPoint;
import org.iceforge.runa.budget.model.EntityAnalyticsSort;
import org.iceforge.runa.budget.model.EntityYearAmount;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.repository.EntityAnalyticsRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ranks reporting entities by their normalized totals, with paging.
 */
@Service
public class EntityAnalyticsService {

    private final EntityAnalyticsRepository repository;
    private final TransformationPipeline pipeline;
    private final UseCaseSupport support;
    private final AnalyticsProperties props;

    public EntityAnalyticsService(EntityAnalyticsRepository repository,
                                  TransformationPipeline pipeline,
                                  UseCaseSupport support,
                                  AnalyticsProperties props) {
        this.repository = Objects.requireNonNull(repository);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.support = Objects.requireNonNull(support);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * @param limit  page size; null means the configured default, clamped to [0, max]
     * @param offset rows to skip; null or negative means 0
     */
    public Mono<AnalyticsResult<EntityAnalyticsPage>> getEntityAnalytics(AnalyticsFilter filter,
                                                                        TransformationOptions options,
                                                                        EntityAnalyticsSort sort,
                                                                        Integer limit,
                                                                        Integer offset) {
        Optional<AnalyticsError> invalid = UseCaseSupport.validate(filter);
        if (invalid.isPresent()) {
            return Mono.just(AnalyticsResult.err(invalid.get()));
        }
        int pageSize = Math.min(Math.max(limit == null ? props.getEntityDefaultLimit() : limit, 0), props.getEntityMaxLimit());
        int skip = Math.max(offset == null ? 0 : offset, 0);
        EntityAnalyticsSort order = sort == null || sort.by() == null ? EntityAnalyticsSort.DEFAULT : sort;
        TransformationOptions effective = new TransformationOptions(
                options.inflationAdjusted(), options.currency(), options.perCapita(), false);

        return support.fetch("Entity analytics query", () -> repository.getYearlyAmounts(filter))
                .flatMap(fetched -> UseCaseSupport.then(fetched, rows -> {
                    if (rows.isEmpty()) {
                        return Mono.just(AnalyticsResult.ok(new EntityAnalyticsPage(List.of(), 0, false, skip > 0)));
                    }
                    return support.normalize(Frequency.YEAR, UseCaseSupport.yearRange(rows),
                            factors -> page(pipeline.aggregate(rows, factors, effective), filter, order, pageSize, skip));
                }));
    }

    static EntityAnalyticsPage page(List<NormalizedTotal<EntityYearAmount>> totals,
                                    AnalyticsFilter filter,
                                    EntityAnalyticsSort sort,
                                    int limit,
                                    int offset) {
        List<NormalizedTotal<EntityYearAmount>> kept = totals.stream()
                .filter(t -> withinThresholds(t.totalAmount(), filter.getAggregateMinAmount(), filter.getAggregateMaxAmount()))
                .sorted(comparator(sort))
                .toList();

        int totalCount = kept.size();
        List<EntityAnalyticsPoint> nodes = kept.stream()
                .skip(offset)
                .limit(limit)
                .map(EntityAnalyticsService::toPoint)
                .toList();
        return new EntityAnalyticsPage(nodes, totalCount, (long) offset + limit < totalCount, offset > 0);
    }

    static boolean withinThresholds(BigDecimal value, BigDecimal min, BigDecimal max) {
        if (min != null && value.compareTo(min) < 0) return false;
        return max == null || value.compareTo(max) <= 0;
    }

    static Comparator<NormalizedTotal<EntityYearAmount>> comparator(EntityAnalyticsSort sort) {
        Comparator<NormalizedTotal<EntityYearAmount>> primary = switch (sort.by()) {
            case AMOUNT -> byValue(NormalizedTotal::amount, sort.order());
            case TOTAL_AMOUNT -> byValue(NormalizedTotal::totalAmount, sort.order());
            case PER_CAPITA_AMOUNT -> byValue(NormalizedTotal::perCapitaAmount, sort.order());
            case ENTITY_NAME -> byValue(t -> t.last().entityName(), sort.order());
            case ENTITY_TYPE -> byValue(t -> t.last().entityType(), sort.order());
            case POPULATION -> byValue(t -> t.last().population(), sort.order());
            case COUNTY_NAME -> byValue(t -> t.last().countyName(), sort.order());
            case COUNTY_CODE -> byValue(t -> t.last().countyCode(), sort.order());
        };
        return primary.thenComparing(t -> t.last().entityCui(), Comparator.nullsLast(Comparator.naturalOrder()));
    }

    /**
     * Nulls sort last in both directions.
     */
    private static <U extends Comparable<? super U>> Comparator<NormalizedTotal<EntityYearAmount>> byValue(
            Function<NormalizedTotal<EntityYearAmount>, U> key, EntityAnalyticsSort.Direction direction) {
        Comparator<U> natural = Comparator.naturalOrder();
        Comparator<U> ordered = direction == EntityAnalyticsSort.Direction.DESC ? natural.reversed() : natural;
        return Comparator.comparing(key, Comparator.nullsLast(ordered));
    }

    private static EntityAnalyticsPoint toPoint(NormalizedTotal<EntityYearAmount> total) {
        EntityYearAmount row = total.last();
        return new EntityAnalyticsPoint(
                row.entityCui(),
                row.entityName(),
                row.entityType(),
                row.uatId() == null ? null : String.valueOf(row.uatId()),
                row.countyCode(),
                row.countyName(),
                row.population(),
                UseCaseSupport.toDouble(total.amount()),
                UseCaseSupport.toDouble(total.totalAmount()),
                UseCaseSupport.toDouble(total.perCapitaAmount()));
    }
}
