package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AccountCategory;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.ExclusionFilter;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.ParsedPeriod;
import org.iceforge.runa.budget.model.PeriodInterval;
import org.iceforge.runa.budget.model.PeriodSelection;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.iceforge.runa.budget.service.SqlConditions.hasValues;

/**
 * Compiles an {@link AnalyticsFilter} into WHERE fragments over the execution line item table.
 *
 * Fragments are emitted in a fixed category order: frequency flag, period, scalar equality,
 * list membership, code prefixes, entity filters, UAT filters, item amounts, exclusions.
 * All fragments are meant to be ANDed.
 */
@Service
public class SqlConditionCompiler {

    public List<String> compile(AnalyticsFilter filter, SqlBuildContext ctx) {
        Objects.requireNonNull(filter);
        Objects.requireNonNull(ctx);
        Objects.requireNonNull(filter.getReportPeriod(), "report_period");

        Frequency frequency = filter.getReportPeriod().getFrequency();
        String eli = ctx.lineItemAlias();
        String e = ctx.entityAlias();
        String u = ctx.uatAlias();

        SqlConditions where = new SqlConditions();

        // Monthly rows carry no flag
        if (frequency == Frequency.QUARTER) {
            where.add(eli + ".is_quarterly = true");
        } else if (frequency == Frequency.YEAR) {
            where.add(eli + ".is_yearly = true");
        }

        where.addAll(compilePeriod(filter.getReportPeriod().getSelection(), frequency, eli));

        if (filter.getAccountCategory() != null) {
            where.eq(eli + ".account_category", filter.getAccountCategory().getCode());
        }
        where.eq(eli + ".report_type", filter.getReportType())
                .eq(eli + ".main_creditor_cui", filter.getMainCreditorCui());

        where.in(eli + ".report_id", filter.getReportIds())
                .in(eli + ".entity_cui", filter.getEntityCuis())
                .in(eli + ".expense_type", filter.getExpenseTypes())
                .in(eli + ".functional_code", filter.getFunctionalCodes())
                .in(eli + ".economic_code", filter.getEconomicCodes())
                .in(eli + ".program_code", filter.getProgramCodes())
                .numericIn(eli + ".funding_source_id", filter.getFundingSourceIds())
                .numericIn(eli + ".budget_sector_id", filter.getBudgetSectorIds());

        where.anyPrefix(eli + ".functional_code", filter.getFunctionalPrefixes())
                .anyPrefix(eli + ".economic_code", filter.getEconomicPrefixes());

        if (ctx.hasEntityJoin()) {
            where.in(e + ".entity_type", filter.getEntityTypes())
                    .eq(e + ".is_uat", filter.getIsUat())
                    .numericIn(e + ".uat_id", filter.getUatIds());
        }

        if (ctx.hasUatJoin()) {
            where.in(u + ".county_code", filter.getCountyCodes())
                    .atLeast(u + ".population", filter.getMinPopulation())
                    .atMost(u + ".population", filter.getMaxPopulation());
        }

        String amount = getAmountColumn(frequency, eli);
        where.atLeast(amount, filter.getItemMinAmount())
                .atMost(amount, filter.getItemMaxAmount());

        if (filter.getExclude() != null) {
            compileExclusions(where, filter.getExclude(), filter.getAccountCategory(), ctx);
        }

        return where.toList();
    }

    /**
     * HAVING fragments for aggregate thresholds, over the per-group sum of the frequency's amount column.
     */
    public List<String> compileHaving(AnalyticsFilter filter, SqlBuildContext ctx) {
        String sum = "COALESCE(SUM(" + getAmountColumn(filter.frequency(), ctx.lineItemAlias()) + "), 0)";
        return new SqlConditions()
                .atLeast(sum, filter.getAggregateMinAmount())
                .atMost(sum, filter.getAggregateMaxAmount())
                .toList();
    }

    /**
     * Amount column read for a frequency. Item-level bounds and aggregations both go through this.
     */
    public static String getAmountColumn(Frequency frequency, String alias) {
        return alias + "." + frequency.getAmountColumn();
    }

    /**
     * Numeric ids in input order; blank and non-numeric tokens are dropped.
     */
    public static List<BigDecimal> numericIds(List<String> ids) {
        return SqlConditions.toNumericIds(ids);
    }

    public static String toWhereClause(List<String> conditions) {
        if (conditions.isEmpty()) return "";
        return "WHERE " + String.join(" AND ", conditions);
    }

    public static String toHavingClause(List<String> conditions) {
        if (conditions.isEmpty()) return "";
        return "HAVING " + String.join(" AND ", conditions);
    }

    /**
     * Whether the filter references columns of the entities table. {@code is_uat} counts only
     * when set explicitly.
     */
    public static boolean needsEntityJoin(AnalyticsFilter filter) {
        ExclusionFilter ex = filter.getExclude();
        return filter.getIsUat() != null
                || hasValues(filter.getEntityTypes())
                || hasValues(filter.getUatIds())
                || hasValues(filter.getCountyCodes())
                || (ex != null && (hasValues(ex.getEntityTypes())
                || hasValues(ex.getUatIds())
                || hasValues(ex.getCountyCodes())));
    }

    public static boolean needsUatJoin(AnalyticsFilter filter) {
        ExclusionFilter ex = filter.getExclude();
        return hasValues(filter.getCountyCodes())
                || filter.getMinPopulation() != null
                || filter.getMaxPopulation() != null
                || (ex != null && hasValues(ex.getCountyCodes()));
    }

    List<String> compilePeriod(PeriodSelection selection, Frequency frequency, String alias) {
        List<String> out = new ArrayList<>();
        if (selection == null) return out;

        if (selection.getInterval() != null) {
            out.addAll(compileInterval(selection.getInterval(), frequency, alias));
        }
        if (hasValues(selection.getDates())) {
            compileDateList(selection.getDates(), frequency, alias).ifPresent(out::add);
        }
        return out;
    }

    private List<String> compileInterval(PeriodInterval interval, Frequency frequency, String alias) {
        if (frequency == Frequency.MONTH || frequency == Frequency.QUARTER) {
            Optional<ParsedPeriod> start = PeriodParser.parse(interval.getStart(), frequency);
            Optional<ParsedPeriod> end = PeriodParser.parse(interval.getEnd(), frequency);
            if (start.isPresent() && end.isPresent()) {
                String tuple = "(" + alias + ".year, " + alias + "." + subPeriodColumn(frequency) + ")";
                return List.of(
                        tuple + " >= (" + start.get().year() + ", " + start.get().subPeriod() + ")",
                        tuple + " <= (" + end.get().year() + ", " + end.get().subPeriod() + ")");
            }
        }

        // YEAR, or a month/quarter interval whose endpoints do not parse at that frequency
        List<String> out = new ArrayList<>();
        OptionalInt startYear = PeriodParser.extractYear(interval.getStart());
        OptionalInt endYear = PeriodParser.extractYear(interval.getEnd());
        if (startYear.isPresent()) {
            out.add(alias + ".year >= " + startYear.getAsInt());
        }
        if (endYear.isPresent()) {
            out.add(alias + ".year <= " + endYear.getAsInt());
        }
        return out;
    }

    private Optional<String> compileDateList(List<String> dates, Frequency frequency, String alias) {
        if (frequency == Frequency.YEAR) {
            List<Integer> years = PeriodParser.parseYears(dates);
            if (years.isEmpty()) return Optional.empty();
            return Optional.of(alias + ".year IN (" + years.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", ")) + ")");
        }

        List<ParsedPeriod> periods = frequency == Frequency.MONTH
                ? PeriodParser.parseMonthPeriods(dates)
                : PeriodParser.parseQuarterPeriods(dates);
        if (periods.isEmpty()) return Optional.empty();

        String column = subPeriodColumn(frequency);
        String ors = periods.stream()
                .map(p -> "(" + alias + ".year = " + p.year() + " AND " + alias + "." + column + " = " + p.subPeriod() + ")")
                .collect(Collectors.joining(" OR "));
        return Optional.of("(" + ors + ")");
    }

    private void compileExclusions(SqlConditions where,
                                   ExclusionFilter ex,
                                   AccountCategory accountCategory,
                                   SqlBuildContext ctx) {
        String eli = ctx.lineItemAlias();

        where.notIn(eli + ".report_id", ex.getReportIds())
                .notIn(eli + ".entity_cui", ex.getEntityCuis())
                .notIn(eli + ".functional_code", ex.getFunctionalCodes())
                .noPrefix(eli + ".functional_code", ex.getFunctionalPrefixes());

        // Income rows are exempt from economic classification exclusions
        if (accountCategory != AccountCategory.INCOME) {
            where.notIn(eli + ".economic_code", ex.getEconomicCodes())
                    .noPrefix(eli + ".economic_code", ex.getEconomicPrefixes());
        }

        if (ctx.hasEntityJoin()) {
            where.nullSafeNotIn(ctx.entityAlias() + ".entity_type", ex.getEntityTypes())
                    .nullSafeNumericNotIn(ctx.entityAlias() + ".uat_id", ex.getUatIds());
        }

        if (ctx.hasUatJoin()) {
            where.nullSafeNotIn(ctx.uatAlias() + ".county_code", ex.getCountyCodes());
        }
    }

    private static String subPeriodColumn(Frequency frequency) {
        return frequency == Frequency.MONTH ? "month" : "quarter";
    }
}
