package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AccountCategory;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.ExclusionFilter;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.PeriodSelection;
import org.iceforge.runa.budget.model.ReportPeriod;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlConditionCompilerTest {

    private final SqlConditionCompiler compiler = new SqlConditionCompiler();

    @Test
    void emitsCategoriesInFixedOrder() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2023", "2024"));
        filter.setReportType("Executie bugetara detaliata");
        filter.setEntityCuis(List.of("4305857", "4562346"));
        filter.setFundingSourceIds(List.of("2", "x"));
        filter.setFunctionalPrefixes(List.of("65."));
        filter.setItemMinAmount(new BigDecimal("100"));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly())).containsExactly(
                "eli.is_yearly = true",
                "eli.year >= 2023",
                "eli.year <= 2024",
                "eli.account_category = 'ch'",
                "eli.report_type = 'Executie bugetara detaliata'",
                "eli.entity_cui IN ('4305857', '4562346')",
                "eli.funding_source_id IN (2)",
                "(eli.functional_code LIKE '65.%')",
                "eli.ytd_amount >= 100");
    }

    @Test
    void sameFilterCompilesToSameFragments() {
        AnalyticsFilter filter = filter(Frequency.MONTH, PeriodSelection.dates(List.of("2024-02", "2024-01")));
        filter.setEconomicCodes(List.of("20.01", "10.01"));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .isEqualTo(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .contains("eli.economic_code IN ('20.01', '10.01')");
    }

    @Test
    void monthIntervalUsesTupleComparison() {
        AnalyticsFilter filter = filter(Frequency.MONTH, PeriodSelection.interval("2023-11", "2024-02"));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly())).containsExactly(
                "(eli.year, eli.month) >= (2023, 11)",
                "(eli.year, eli.month) <= (2024, 2)",
                "eli.account_category = 'ch'");
    }

    @Test
    void quarterDatesBecomeDisjunction() {
        AnalyticsFilter filter = filter(Frequency.QUARTER, PeriodSelection.dates(List.of("2024-Q1", "bad", "2024-Q3")));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly())).containsExactly(
                "eli.is_quarterly = true",
                "((eli.year = 2024 AND eli.quarter = 1) OR (eli.year = 2024 AND eli.quarter = 3))",
                "eli.account_category = 'ch'");
    }

    @Test
    void unparsableMonthIntervalFallsBackToYearBounds() {
        AnalyticsFilter filter = filter(Frequency.MONTH, PeriodSelection.interval("2023", "2024-06"));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .containsExactly("eli.year >= 2023", "eli.year <= 2024", "eli.account_category = 'ch'");
    }

    @Test
    void yearDatesBecomeInList() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.dates(List.of("2022", "2024-05")));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .contains("eli.year IN (2022, 2024)");
    }

    @Test
    void entityAndUatFiltersNeedTheirJoins() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        filter.setEntityTypes(List.of("uat"));
        filter.setIsUat(true);
        filter.setUatIds(List.of("07", "x"));
        filter.setCountyCodes(List.of("CJ"));
        filter.setMinPopulation(1000L);
        ExclusionFilter ex = new ExclusionFilter();
        ex.setEntityTypes(List.of("school"));
        ex.setUatIds(List.of("3"));
        ex.setCountyCodes(List.of("B"));
        filter.setExclude(ex);

        List<String> bare = compiler.compile(filter, SqlBuildContext.lineItemsOnly());
        assertThat(bare).noneMatch(f -> f.contains("e.") && !f.contains("eli."));
        assertThat(bare).noneMatch(f -> f.contains("u.county_code") || f.contains("u.population"));

        assertThat(compiler.compile(filter, SqlBuildContext.of(true, true))).containsSubsequence(
                "e.entity_type IN ('uat')",
                "e.is_uat = true",
                "e.uat_id IN (7)",
                "u.county_code IN ('CJ')",
                "u.population >= 1000",
                "(e.entity_type IS NULL OR e.entity_type NOT IN ('school'))",
                "(e.uat_id IS NULL OR e.uat_id NOT IN (3))",
                "(u.county_code IS NULL OR u.county_code NOT IN ('B'))");
    }

    @Test
    void aliasesAreHonoured() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        filter.setIsUat(false);

        assertThat(compiler.compile(filter, SqlBuildContext.of(true, false).withAliases("li", "ent", "uat")))
                .containsExactly("li.is_yearly = true", "li.year >= 2024", "li.year <= 2024",
                        "li.account_category = 'ch'", "ent.is_uat = false");
    }

    @Test
    void absentIsUatCompilesNothingEvenWithEntityJoin() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        filter.setEntityTypes(List.of("uat"));

        assertThat(compiler.compile(filter, SqlBuildContext.of(true, false)))
                .contains("e.entity_type IN ('uat')")
                .noneMatch(f -> f.contains("is_uat"));
    }

    @Test
    void nullListElementsAreDropped() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        filter.setEntityCuis(Arrays.asList("123", null));
        filter.setFunctionalPrefixes(Arrays.asList(null, "65."));
        filter.setProgramCodes(Arrays.asList((String) null));
        filter.setEntityTypes(Arrays.asList(null, null));
        ExclusionFilter ex = new ExclusionFilter();
        ex.setEntityCuis(Arrays.asList(null, "999"));
        ex.setEconomicPrefixes(Arrays.asList("20", null));
        ex.setEntityTypes(Arrays.asList((String) null));
        filter.setExclude(ex);

        assertThat(compiler.compile(filter, SqlBuildContext.of(true, false)))
                .contains("eli.entity_cui IN ('123')",
                        "(eli.functional_code LIKE '65.%')",
                        "eli.entity_cui NOT IN ('999')",
                        "(eli.economic_code NOT LIKE '20%')")
                .noneMatch(f -> f.contains("program_code"))
                .noneMatch(f -> f.contains("entity_type"))
                .noneMatch(f -> f.contains("null"));
    }

    @Test
    void incomeIgnoresEconomicExclusions() {
        ExclusionFilter ex = new ExclusionFilter();
        ex.setFunctionalCodes(List.of("51.01"));
        ex.setEconomicCodes(List.of("10.01"));
        ex.setEconomicPrefixes(List.of("20", "59"));

        AnalyticsFilter income = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        income.setAccountCategory(AccountCategory.INCOME);
        income.setExclude(ex);

        assertThat(compiler.compile(income, SqlBuildContext.lineItemsOnly()))
                .contains("eli.functional_code NOT IN ('51.01')")
                .noneMatch(f -> f.contains("economic_code"));

        AnalyticsFilter expense = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        expense.setExclude(ex);

        assertThat(compiler.compile(expense, SqlBuildContext.lineItemsOnly())).contains(
                "eli.economic_code NOT IN ('10.01')",
                "(eli.economic_code NOT LIKE '20%' AND eli.economic_code NOT LIKE '59%')");
    }

    @Test
    void quotesAreEscaped() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        filter.setReportType("x' OR '1'='1");

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .contains("eli.report_type = 'x'' OR ''1''=''1'");
    }

    @Test
    void itemBoundsFollowFrequencyColumn() {
        AnalyticsFilter filter = filter(Frequency.QUARTER, PeriodSelection.interval("2024-Q1", "2024-Q2"));
        filter.setItemMinAmount(new BigDecimal("10.50"));
        filter.setItemMaxAmount(new BigDecimal("99"));

        assertThat(compiler.compile(filter, SqlBuildContext.lineItemsOnly()))
                .endsWith("eli.quarterly_amount >= 10.50", "eli.quarterly_amount <= 99");
    }

    @Test
    void havingBoundsTheGroupSum() {
        AnalyticsFilter filter = filter(Frequency.MONTH, PeriodSelection.interval("2024-01", "2024-03"));
        filter.setAggregateMinAmount(new BigDecimal("1000"));
        filter.setAggregateMaxAmount(new BigDecimal("5000.5"));

        List<String> having = compiler.compileHaving(filter, SqlBuildContext.lineItemsOnly());

        assertThat(having).containsExactly(
                "COALESCE(SUM(eli.monthly_amount), 0) >= 1000",
                "COALESCE(SUM(eli.monthly_amount), 0) <= 5000.5");
        assertThat(SqlConditionCompiler.toHavingClause(having)).startsWith("HAVING ").contains(" AND ");
        assertThat(SqlConditionCompiler.toHavingClause(List.of())).isEmpty();
        assertThat(SqlConditionCompiler.toWhereClause(List.of("a = 1", "b = 2"))).isEqualTo("WHERE a = 1 AND b = 2");
    }

    @Test
    void numericIdsDropJunk() {
        assertThat(SqlConditionCompiler.numericIds(Arrays.asList("1", " 2 ", "abc", "", null, "3.5", "4;DROP")))
                .containsExactly(new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("3.5"));
    }

    @Test
    void joinRequirementsFollowReferencedColumns() {
        AnalyticsFilter filter = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        assertThat(SqlConditionCompiler.needsEntityJoin(filter)).isFalse();
        assertThat(SqlConditionCompiler.needsUatJoin(filter)).isFalse();

        filter.setMaxPopulation(50_000L);
        assertThat(SqlConditionCompiler.needsUatJoin(filter)).isTrue();
        assertThat(SqlConditionCompiler.needsEntityJoin(filter)).isFalse();

        AnalyticsFilter excluded = filter(Frequency.YEAR, PeriodSelection.interval("2024", "2024"));
        ExclusionFilter ex = new ExclusionFilter();
        ex.setCountyCodes(List.of("B"));
        excluded.setExclude(ex);
        assertThat(SqlConditionCompiler.needsEntityJoin(excluded)).isTrue();
        assertThat(SqlConditionCompiler.needsUatJoin(excluded)).isTrue();
    }

    private static AnalyticsFilter filter(Frequency frequency, PeriodSelection selection) {
        AnalyticsFilter filter = new AnalyticsFilter();
        filter.setAccountCategory(AccountCategory.EXPENSE);
        filter.setReportPeriod(new ReportPeriod(frequency, selection));
        return filter;
    }
}
