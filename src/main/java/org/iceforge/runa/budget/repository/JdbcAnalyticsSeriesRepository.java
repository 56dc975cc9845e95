package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.PeriodAmount;
import org.iceforge.runa.budget.model.SeriesData;
import org.iceforge.runa.budget.service.SqlBuildContext;
import org.iceforge.runa.budget.service.SqlConditionCompiler;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Period totals for a filter, with the population of the area the filter selects.
 *
 * Population is resolved from the most specific filter present: entity CUIs, then UAT ids,
 * then county codes. Without any of those it is the country total.
 */
@Repository
public class JdbcAnalyticsSeriesRepository extends JdbcAnalyticsSupport implements AnalyticsSeriesRepository {

    public JdbcAnalyticsSeriesRepository(JdbcTemplate jdbc, SqlConditionCompiler compiler) {
        super(jdbc, compiler);
    }

    @Override
    public Mono<SeriesData> getSeries(AnalyticsFilter filter) {
        return fetchPoints(filter)
                .flatMap(points -> fetchPopulation(filter)
                        .map(pop -> new SeriesData(points, pop > 0 ? pop : null))
                        .defaultIfEmpty(new SeriesData(points, null)));
    }

    Mono<List<PeriodAmount>> fetchPoints(AnalyticsFilter filter) {
        return query("analytics series", () -> pointsSql(filter), (rs, i) -> new PeriodAmount(
                rs.getInt("year"),
                rs.getInt("sub_period"),
                rs.getBigDecimal("amount")));
    }

    String pointsSql(AnalyticsFilter filter) {
        boolean uatJoin = SqlConditionCompiler.needsUatJoin(filter);
        boolean entityJoin = uatJoin || SqlConditionCompiler.needsEntityJoin(filter);
        SqlBuildContext ctx = SqlBuildContext.of(entityJoin, uatJoin);

        Frequency frequency = filter.frequency();
        String subPeriod = switch (frequency) {
            case MONTH -> "eli.month";
            case QUARTER -> "eli.quarter";
            case YEAR -> "0";
        };
        String groupBy = frequency == Frequency.YEAR ? "eli.year" : "eli.year, " + subPeriod;

        return "SELECT eli.year, " + subPeriod + " AS sub_period, "
                + amountSum(filter, ctx) + " AS amount"
                + " FROM executionlineitems eli"
                + (entityJoin ? " LEFT JOIN entities e ON eli.entity_cui = e.cui" : "")
                + (uatJoin ? " LEFT JOIN uats u ON e.uat_id = u.id" : "")
                + " " + where(filter, ctx)
                + " GROUP BY " + groupBy
                + " " + having(filter, ctx)
                + " ORDER BY " + groupBy;
    }

    Mono<Long> fetchPopulation(AnalyticsFilter filter) {
        return Mono.fromCallable(() -> {
                    PopulationQuery q = populationQuery(filter);
                    log.debug("series population sql: {}", q.sql());
                    Long population = jdbc.queryForObject(q.sql(), Long.class, q.args().toArray());
                    return population == null ? 0L : population;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(e -> log.warn("series population failed: {}", e.getMessage()));
    }

    PopulationQuery populationQuery(AnalyticsFilter filter) {
        List<String> cuis = present(filter.getEntityCuis());
        if (!cuis.isEmpty()) {
            return new PopulationQuery("SELECT COALESCE(SUM(u.population), 0) FROM uats u WHERE u.id IN"
                    + " (SELECT e.uat_id FROM entities e WHERE e.cui IN (" + placeholders(cuis.size()) + "))",
                    new ArrayList<>(cuis));
        }
        List<BigDecimal> ids = SqlConditionCompiler.numericIds(filter.getUatIds());
        if (!ids.isEmpty()) {
            return new PopulationQuery("SELECT COALESCE(SUM(u.population), 0) FROM uats u WHERE u.id IN ("
                    + placeholders(ids.size()) + ")", new ArrayList<>(ids));
        }
        List<String> counties = present(filter.getCountyCodes());
        if (!counties.isEmpty()) {
            return new PopulationQuery("SELECT COALESCE(SUM(c.population), 0) FROM uats c WHERE " + countyLevelUat("c")
                    + " AND c.county_code IN (" + placeholders(counties.size()) + ")", new ArrayList<>(counties));
        }
        return new PopulationQuery("SELECT COALESCE(SUM(c.population), 0) FROM uats c WHERE " + countyLevelUat("c"),
                List.of());
    }

    record PopulationQuery(String sql, List<Object> args) {
    }

    private static List<String> present(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
