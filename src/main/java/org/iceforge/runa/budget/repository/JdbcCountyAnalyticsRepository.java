package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.HeatmapCountyDataPoint;
import org.iceforge.runa.budget.service.SqlBuildContext;
import org.iceforge.runa.budget.service.SqlConditionCompiler;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Rolls UAT line items up to their county. County population and the county council CUI come
 * from the county-level UAT row.
 */
@Repository
public class JdbcCountyAnalyticsRepository extends JdbcAnalyticsSupport implements CountyAnalyticsRepository {

    public JdbcCountyAnalyticsRepository(JdbcTemplate jdbc, SqlConditionCompiler compiler) {
        super(jdbc, compiler);
    }

    @Override
    public Mono<List<HeatmapCountyDataPoint>> getHeatmapData(AnalyticsFilter filter) {
        return query("county heatmap", () -> heatmapSql(filter), (rs, i) -> new HeatmapCountyDataPoint(
                rs.getString("county_code"),
                rs.getString("county_name"),
                nullableLong(rs, "county_population"),
                rs.getString("county_entity_cui"),
                rs.getInt("year"),
                rs.getBigDecimal("total_amount")));
    }

    String heatmapSql(AnalyticsFilter filter) {
        boolean entityJoin = SqlConditionCompiler.needsEntityJoin(filter);
        SqlBuildContext ctx = SqlBuildContext.of(entityJoin, true);

        String countyInfo = "SELECT c.county_code, MAX(c.county_name) AS county_name,"
                + " MAX(c.population) AS county_population, MAX(c.uat_code) AS county_entity_cui"
                + " FROM uats c WHERE " + countyLevelUat("c")
                + " GROUP BY c.county_code";

        return "SELECT u.county_code, COALESCE(ci.county_name, MAX(u.county_name)) AS county_name,"
                + " ci.county_population, ci.county_entity_cui, eli.year, "
                + amountSum(filter, ctx) + " AS total_amount"
                + " FROM executionlineitems eli"
                + " INNER JOIN uats u ON eli.entity_cui = u.uat_code"
                + " LEFT JOIN (" + countyInfo + ") ci ON ci.county_code = u.county_code"
                + (entityJoin ? " LEFT JOIN entities e ON eli.entity_cui = e.cui" : "")
                + " " + where(filter, ctx)
                + " GROUP BY u.county_code, ci.county_name, ci.county_population, ci.county_entity_cui, eli.year"
                + " " + having(filter, ctx)
                + " ORDER BY u.county_code, eli.year";
    }
}
