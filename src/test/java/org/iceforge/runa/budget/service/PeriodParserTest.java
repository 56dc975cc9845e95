package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.ParsedPeriod;
import org.iceforge.runa.budget.model.PeriodSelection;
import org.iceforge.runa.budget.model.YearRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodParserTest {

    @Test
    void monthAcceptsOnlyYearDashMonth() {
        assertThat(PeriodParser.parse("2024-06", Frequency.MONTH)).contains(new ParsedPeriod(2024, 6));
        assertThat(PeriodParser.parse("2024", Frequency.MONTH)).isEmpty();
        assertThat(PeriodParser.parse("2024-Q2", Frequency.MONTH)).isEmpty();
        assertThat(PeriodParser.parse("2024-13", Frequency.MONTH)).isEmpty();
        assertThat(PeriodParser.parse("2024-00", Frequency.MONTH)).isEmpty();
        assertThat(PeriodParser.parse("2024-6", Frequency.MONTH)).isEmpty();
    }

    @Test
    void quarterAcceptsOnlyYearDashQ() {
        assertThat(PeriodParser.parse("2024-Q2", Frequency.QUARTER)).contains(new ParsedPeriod(2024, 2));
        assertThat(PeriodParser.parse("2024-Q5", Frequency.QUARTER)).isEmpty();
        assertThat(PeriodParser.parse("2024-06", Frequency.QUARTER)).isEmpty();
        assertThat(PeriodParser.parse("2024", Frequency.QUARTER)).isEmpty();
    }

    @Test
    void yearTakesTheFourDigitPrefix() {
        assertThat(PeriodParser.parse("2024", Frequency.YEAR)).contains(ParsedPeriod.ofYear(2024));
        assertThat(PeriodParser.parse("2024-06", Frequency.YEAR)).contains(ParsedPeriod.ofYear(2024));
        assertThat(PeriodParser.parse("2024-Q3", Frequency.YEAR)).contains(ParsedPeriod.ofYear(2024));
        assertThat(PeriodParser.parse("FY24", Frequency.YEAR)).isEmpty();
        assertThat(PeriodParser.parse("202", Frequency.YEAR)).isEmpty();
    }

    @Test
    void nullAndGarbageNeverThrow() {
        for (Frequency f : Frequency.values()) {
            assertThat(PeriodParser.parse(null, f)).isEmpty();
            assertThat(PeriodParser.parse("", f)).isEmpty();
            assertThat(PeriodParser.parse("not-a-period", f)).isEmpty();
        }
        assertThat(PeriodParser.parse("2024", null)).isEqualTo(Optional.empty());
    }

    @Test
    void batchParsersDropInvalidEntriesAndKeepOrder() {
        List<String> input = Arrays.asList("2024-03", "junk", "2023-11", null, "2024-Q1", "2022-01");

        assertThat(PeriodParser.parseMonthPeriods(input)).containsExactly(
                new ParsedPeriod(2024, 3), new ParsedPeriod(2023, 11), new ParsedPeriod(2022, 1));
        assertThat(PeriodParser.parseQuarterPeriods(input)).containsExactly(new ParsedPeriod(2024, 1));
        assertThat(PeriodParser.parseYears(input)).containsExactly(2024, 2023, 2024, 2022);
    }

    @Test
    void labelsRoundTripThroughPreviousLabel() {
        assertThat(PeriodParser.formatLabel(2024, 3, Frequency.MONTH)).isEqualTo("2024-03");
        assertThat(PeriodParser.formatLabel(2024, 3, Frequency.QUARTER)).isEqualTo("2024-Q3");
        assertThat(PeriodParser.formatLabel(2024, 0, Frequency.YEAR)).isEqualTo("2024");

        assertThat(PeriodParser.previousLabel("2024-01", Frequency.MONTH)).contains("2023-12");
        assertThat(PeriodParser.previousLabel("2024-Q1", Frequency.QUARTER)).contains("2023-Q4");
        assertThat(PeriodParser.previousLabel("2024-Q3", Frequency.QUARTER)).contains("2024-Q2");
        assertThat(PeriodParser.previousLabel("2024", Frequency.YEAR)).contains("2023");
        assertThat(PeriodParser.previousLabel("2024-Q3", Frequency.MONTH)).isEmpty();
    }

    @Test
    void labelsCoverEveryPeriodBetweenYears() {
        assertThat(PeriodParser.labels(2023, 2024, Frequency.QUARTER)).containsExactly(
                "2023-Q1", "2023-Q2", "2023-Q3", "2023-Q4", "2024-Q1", "2024-Q2", "2024-Q3", "2024-Q4");
        assertThat(PeriodParser.labels(2024, 2024, Frequency.MONTH)).hasSize(12).startsWith("2024-01").endsWith("2024-12");
        assertThat(PeriodParser.labels(2025, 2024, Frequency.YEAR)).isEmpty();
    }

    @Test
    void yearRangeSpansIntervalAndDates() {
        PeriodSelection selection = PeriodSelection.interval("2021-03", "2022-11");
        selection.setDates(List.of("2019-Q4", "2023"));

        assertThat(PeriodParser.extractYearRange(selection)).isEqualTo(new YearRange(2019, 2023));
        assertThat(PeriodParser.extractYearRange(PeriodSelection.dates(List.of("2020")))).isEqualTo(new YearRange(2020, 2020));
    }
}
