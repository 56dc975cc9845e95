package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.service.SqlBuildContext;
import org.iceforge.runa.budget.service.SqlConditionCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Shared plumbing for the JDBC analytics repositories: compiled filter clauses, blocking calls
 * moved off the event loop, and nullable column reads.
 */
abstract class JdbcAnalyticsSupport {

    /** Bucharest has no county-level UAT; its municipality row stands in. */
    static final String BUCHAREST_COUNTY_CODE = "B";
    static final String BUCHAREST_SIRUTA_CODE = "179132";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final JdbcTemplate jdbc;
    protected final SqlConditionCompiler compiler;

    protected JdbcAnalyticsSupport(JdbcTemplate jdbc, SqlConditionCompiler compiler) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.compiler = Objects.requireNonNull(compiler);
    }

    /**
     * Runs the statement on a blocking-friendly scheduler. {@code sql} is built on subscription, so a
     * filter that fails to compile surfaces as an error signal.
     */
    protected <T> Mono<List<T>> query(String operation, Supplier<String> sqlBuilder, RowMapper<T> mapper) {
        return Mono.fromCallable(() -> {
                    String sql = sqlBuilder.get();
                    log.debug("{} sql: {}", operation, sql);
                    List<T> rows = jdbc.query(sql, mapper);
                    log.debug("{} returned {} rows", operation, rows.size());
                    return rows;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(e -> log.warn("{} failed: {}", operation, e.getMessage()));
    }

    protected String where(AnalyticsFilter filter, SqlBuildContext ctx) {
        return SqlConditionCompiler.toWhereClause(compiler.compile(filter, ctx));
    }

    protected String having(AnalyticsFilter filter, SqlBuildContext ctx) {
        return SqlConditionCompiler.toHavingClause(compiler.compileHaving(filter, ctx));
    }

    protected static String amountSum(AnalyticsFilter filter, SqlBuildContext ctx) {
        return "COALESCE(SUM(" + SqlConditionCompiler.getAmountColumn(filter.frequency(), ctx.lineItemAlias()) + "), 0)";
    }

    /**
     * Predicate selecting the UAT row that carries a county's population.
     */
    protected static String countyLevelUat(String alias) {
        return "((" + alias + ".county_code = '" + BUCHAREST_COUNTY_CODE + "' AND " + alias + ".siruta_code = '" + BUCHAREST_SIRUTA_CODE + "')"
                + " OR (" + alias + ".county_code <> '" + BUCHAREST_COUNTY_CODE + "' AND " + alias + ".siruta_code = " + alias + ".county_code))";
    }

    protected static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
