package org.iceforge.runa.budget.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Accumulates WHERE fragments in insertion order. Values are rendered as literals; list order is
 * preserved as given.
 */
final class SqlConditions {

    private static final Pattern NUMERIC = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    private final List<String> fragments = new ArrayList<>();

    SqlConditions add(String fragment) {
        fragments.add(fragment);
        return this;
    }

    SqlConditions addAll(List<String> more) {
        fragments.addAll(more);
        return this;
    }

    SqlConditions eq(String column, String value) {
        if (value != null) {
            fragments.add(column + " = " + quote(value));
        }
        return this;
    }

    SqlConditions eq(String column, Boolean value) {
        if (value != null) {
            fragments.add(column + " = " + value);
        }
        return this;
    }

    SqlConditions in(String column, List<String> values) {
        List<String> present = present(values);
        if (!present.isEmpty()) {
            fragments.add(column + " IN (" + quoteAll(present) + ")");
        }
        return this;
    }

    SqlConditions notIn(String column, List<String> values) {
        List<String> present = present(values);
        if (!present.isEmpty()) {
            fragments.add(column + " NOT IN (" + quoteAll(present) + ")");
        }
        return this;
    }

    SqlConditions numericIn(String column, List<String> values) {
        String ids = joinNumeric(values);
        if (!ids.isEmpty()) {
            fragments.add(column + " IN (" + ids + ")");
        }
        return this;
    }

    /**
     * Negation on a column reached through an outer join: rows without a match are kept.
     */
    SqlConditions nullSafeNotIn(String column, List<String> values) {
        List<String> present = present(values);
        if (!present.isEmpty()) {
            fragments.add("(" + column + " IS NULL OR " + column + " NOT IN (" + quoteAll(present) + "))");
        }
        return this;
    }

    SqlConditions nullSafeNumericNotIn(String column, List<String> values) {
        String ids = joinNumeric(values);
        if (!ids.isEmpty()) {
            fragments.add("(" + column + " IS NULL OR " + column + " NOT IN (" + ids + "))");
        }
        return this;
    }

    SqlConditions anyPrefix(String column, List<String> prefixes) {
        List<String> present = present(prefixes);
        if (!present.isEmpty()) {
            String ors = present.stream()
                    .map(p -> column + " LIKE " + quote(p + "%"))
                    .collect(Collectors.joining(" OR "));
            fragments.add("(" + ors + ")");
        }
        return this;
    }

    SqlConditions noPrefix(String column, List<String> prefixes) {
        List<String> present = present(prefixes);
        if (!present.isEmpty()) {
            String ands = present.stream()
                    .map(p -> column + " NOT LIKE " + quote(p + "%"))
                    .collect(Collectors.joining(" AND "));
            fragments.add("(" + ands + ")");
        }
        return this;
    }

    SqlConditions atLeast(String expression, BigDecimal bound) {
        if (bound != null) {
            fragments.add(expression + " >= " + bound.toPlainString());
        }
        return this;
    }

    SqlConditions atMost(String expression, BigDecimal bound) {
        if (bound != null) {
            fragments.add(expression + " <= " + bound.toPlainString());
        }
        return this;
    }

    SqlConditions atLeast(String expression, Long bound) {
        return atLeast(expression, bound == null ? null : BigDecimal.valueOf(bound));
    }

    SqlConditions atMost(String expression, Long bound) {
        return atMost(expression, bound == null ? null : BigDecimal.valueOf(bound));
    }

    List<String> toList() {
        return Collections.unmodifiableList(new ArrayList<>(fragments));
    }

    static boolean hasValues(List<?> values) {
        return values != null && !values.isEmpty();
    }

    /**
     * Keeps the numeric tokens of {@code ids} in order; blank and non-numeric tokens are dropped.
     */
    static List<BigDecimal> toNumericIds(List<String> ids) {
        List<BigDecimal> out = new ArrayList<>();
        if (ids == null) return out;
        for (String id : ids) {
            if (id == null || id.isBlank()) continue;
            String trimmed = id.trim();
            if (NUMERIC.matcher(trimmed).matches()) {
                out.add(new BigDecimal(trimmed));
            }
        }
        return out;
    }

    /**
     * {@code values} without its null elements; JSON arrays may carry them.
     */
    static List<String> present(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String quoteAll(List<String> values) {
        return values.stream().map(SqlConditions::quote).collect(Collectors.joining(", "));
    }

    private static String joinNumeric(List<String> values) {
        return toNumericIds(values).stream()
                .map(n -> n.stripTrailingZeros().toPlainString())
                .collect(Collectors.joining(", "));
    }
}
