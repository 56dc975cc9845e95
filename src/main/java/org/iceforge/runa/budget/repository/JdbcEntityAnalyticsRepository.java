package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.EntityYearAmount;
import org.iceforge.runa.budget.service.SqlBuildContext;
import org.iceforge.runa.budget.service.SqlConditionCompiler;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Per-entity yearly totals. UAT entities take their UAT's population; county councils take the
 * population of their county; other entities have none.
 */
@Repository
public class JdbcEntityAnalyticsRepository extends JdbcAnalyticsSupport implements EntityAnalyticsRepository {

    static final String COUNTY_COUNCIL_TYPE = "admin_county_council";

    public JdbcEntityAnalyticsRepository(JdbcTemplate jdbc, SqlConditionCompiler compiler) {
        super(jdbc, compiler);
    }

    @Override
    public Mono<List<EntityYearAmount>> getYearlyAmounts(AnalyticsFilter filter) {
        return query("entity analytics", () -> yearlyAmountsSql(filter), (rs, i) -> new EntityYearAmount(
                rs.getString("entity_cui"),
                rs.getString("entity_name"),
                rs.getString("entity_type"),
                nullableLong(rs, "uat_id"),
                rs.getString("county_code"),
                rs.getString("county_name"),
                nullableLong(rs, "population"),
                rs.getInt("year"),
                rs.getBigDecimal("total_amount")));
    }

    String yearlyAmountsSql(AnalyticsFilter filter) {
        SqlBuildContext ctx = SqlBuildContext.of(true, true);

        String countyPopulation = "SELECT c.county_code, MAX(c.population) AS county_population"
                + " FROM uats c WHERE " + countyLevelUat("c")
                + " GROUP BY c.county_code";

        return "SELECT e.cui AS entity_cui, e.name AS entity_name, e.entity_type, e.uat_id,"
                + " u.county_code, u.county_name,"
                + " CASE WHEN e.is_uat = true THEN u.population"
                + " WHEN e.entity_type = '" + COUNTY_COUNCIL_TYPE + "' THEN cp.county_population"
                + " ELSE NULL END AS population,"
                + " eli.year, " + amountSum(filter, ctx) + " AS total_amount"
                + " FROM executionlineitems eli"
                + " INNER JOIN entities e ON eli.entity_cui = e.cui"
                + " LEFT JOIN uats u ON e.uat_id = u.id"
                + " LEFT JOIN (" + countyPopulation + ") cp ON cp.county_code = u.county_code"
                + " " + where(filter, ctx)
                + " GROUP BY e.cui, e.name, e.entity_type, e.uat_id, e.is_uat, u.county_code, u.county_name,"
                + " u.population, cp.county_population, eli.year"
                + " ORDER BY e.cui, eli.year";
    }
}
