package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.HeatmapUatDataPoint;
import org.iceforge.runa.budget.service.SqlBuildContext;
import org.iceforge.runa.budget.service.SqlConditionCompiler;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;

@Repository
public class JdbcUatAnalyticsRepository extends JdbcAnalyticsSupport implements UatAnalyticsRepository {

    public JdbcUatAnalyticsRepository(JdbcTemplate jdbc, SqlConditionCompiler compiler) {
        super(jdbc, compiler);
    }

    @Override
    public Mono<List<HeatmapUatDataPoint>> getHeatmapData(AnalyticsFilter filter) {
        return query("uat heatmap", () -> heatmapSql(filter), (rs, i) -> new HeatmapUatDataPoint(
                rs.getLong("uat_id"),
                rs.getString("uat_code"),
                rs.getString("uat_name"),
                rs.getString("siruta_code"),
                rs.getString("county_code"),
                rs.getString("county_name"),
                rs.getString("region"),
                nullableLong(rs, "population"),
                rs.getInt("year"),
                rs.getBigDecimal("total_amount")));
    }

    String heatmapSql(AnalyticsFilter filter) {
        boolean entityJoin = SqlConditionCompiler.needsEntityJoin(filter);
        SqlBuildContext ctx = SqlBuildContext.of(entityJoin, true);

        return "SELECT u.id AS uat_id, u.uat_code, u.name AS uat_name, u.siruta_code, u.county_code,"
                + " u.county_name, u.region, u.population, eli.year, "
                + amountSum(filter, ctx) + " AS total_amount"
                + " FROM executionlineitems eli"
                + " INNER JOIN uats u ON eli.entity_cui = u.uat_code"
                + (entityJoin ? " LEFT JOIN entities e ON eli.entity_cui = e.cui" : "")
                + " " + where(filter, ctx)
                + " GROUP BY u.id, u.uat_code, u.name, u.siruta_code, u.county_code, u.county_name, u.region,"
                + " u.population, eli.year"
                + " " + having(filter, ctx)
                + " ORDER BY u.id, eli.year";
    }
}
