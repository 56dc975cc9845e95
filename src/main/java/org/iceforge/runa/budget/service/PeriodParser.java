package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.ParsedPeriod;
import org.iceforge.runa.budget.model.PeriodSelection;
import org.iceforge.runa.budget.model.YearRange;

import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses period labels: {@code YYYY}, {@code YYYY-MM} and {@code YYYY-QN}.
 *
 * Nothing here throws on bad input; unparsable values yield an empty result.
 */
public final class PeriodParser {

    private static final Pattern MONTH = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");
    private static final Pattern QUARTER = Pattern.compile("^(\\d{4})-Q([1-4])$");
    private static final Pattern YEAR_PREFIX = Pattern.compile("^\\d{4}");

    private PeriodParser() {
    }

    /**
     * Parses {@code period} in the lexical format of {@code frequency}. YEAR accepts any string
     * starting with four digits.
     */
    public static Optional<ParsedPeriod> parse(String period, Frequency frequency) {
        if (period == null || frequency == null) return Optional.empty();
        return switch (frequency) {
            case MONTH -> parseMonth(period);
            case QUARTER -> parseQuarter(period);
            case YEAR -> {
                OptionalInt year = extractYear(period);
                yield year.isPresent() ? Optional.of(ParsedPeriod.ofYear(year.getAsInt())) : Optional.empty();
            }
        };
    }

    public static Optional<ParsedPeriod> parseMonth(String period) {
        return match(MONTH, period);
    }

    public static Optional<ParsedPeriod> parseQuarter(String period) {
        return match(QUARTER, period);
    }

    public static OptionalInt extractYear(String period) {
        if (period == null || period.length() < 4) return OptionalInt.empty();
        if (!YEAR_PREFIX.matcher(period).find()) return OptionalInt.empty();
        return OptionalInt.of(Integer.parseInt(period.substring(0, 4)));
    }

    public static List<ParsedPeriod> parseMonthPeriods(List<String> periods) {
        List<ParsedPeriod> out = new ArrayList<>();
        if (periods == null) return out;
        for (String p : periods) {
            parseMonth(p).ifPresent(out::add);
        }
        return out;
    }

    public static List<ParsedPeriod> parseQuarterPeriods(List<String> periods) {
        List<ParsedPeriod> out = new ArrayList<>();
        if (periods == null) return out;
        for (String p : periods) {
            parseQuarter(p).ifPresent(out::add);
        }
        return out;
    }

    public static List<Integer> parseYears(List<String> periods) {
        List<Integer> out = new ArrayList<>();
        if (periods == null) return out;
        for (String p : periods) {
            extractYear(p).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Smallest and largest year touched by a selection, reading the year prefix of interval
     * endpoints and listed dates. Falls back to the current year when nothing parses.
     */
    public static YearRange extractYearRange(PeriodSelection selection) {
        List<String> candidates = new ArrayList<>();
        if (selection != null) {
            if (selection.getInterval() != null) {
                candidates.add(selection.getInterval().getStart());
                candidates.add(selection.getInterval().getEnd());
            }
            if (selection.getDates() != null) {
                candidates.addAll(selection.getDates());
            }
        }
        List<Integer> years = parseYears(candidates);
        if (years.isEmpty()) {
            int current = Year.now().getValue();
            return new YearRange(current, current);
        }
        int min = years.stream().mapToInt(Integer::intValue).min().getAsInt();
        int max = years.stream().mapToInt(Integer::intValue).max().getAsInt();
        return new YearRange(min, max);
    }

    public static String formatLabel(int year, int subPeriod, Frequency frequency) {
        return switch (frequency) {
            case MONTH -> String.format("%d-%02d", year, subPeriod);
            case QUARTER -> year + "-Q" + subPeriod;
            case YEAR -> String.valueOf(year);
        };
    }

    /**
     * Label of the period right before {@code label}, e.g. {@code 2024-01 -> 2023-12}.
     */
    public static Optional<String> previousLabel(String label, Frequency frequency) {
        return parse(label, frequency).map(p -> switch (frequency) {
            case MONTH -> p.subPeriod() == 1
                    ? formatLabel(p.year() - 1, 12, frequency)
                    : formatLabel(p.year(), p.subPeriod() - 1, frequency);
            case QUARTER -> p.subPeriod() == 1
                    ? formatLabel(p.year() - 1, 4, frequency)
                    : formatLabel(p.year(), p.subPeriod() - 1, frequency);
            case YEAR -> String.valueOf(p.year() - 1);
        });
    }

    /**
     * All labels of {@code frequency} between two years, inclusive and in order.
     */
    public static List<String> labels(int startYear, int endYear, Frequency frequency) {
        int perYear = switch (frequency) {
            case MONTH -> 12;
            case QUARTER -> 4;
            case YEAR -> 1;
        };
        List<String> out = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            for (int sub = 1; sub <= perYear; sub++) {
                out.add(formatLabel(year, sub, frequency));
            }
        }
        return out;
    }

    private static Optional<ParsedPeriod> match(Pattern pattern, String period) {
        if (period == null) return Optional.empty();
        Matcher m = pattern.matcher(period);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new ParsedPeriod(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    }
}
