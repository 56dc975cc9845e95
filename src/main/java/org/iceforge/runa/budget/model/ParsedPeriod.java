package org.iceforge.runa.budget.model;

/**
 * A parsed period. {@code subPeriod} is the month (1-12) or quarter (1-4), and 0 for a year.
 */
public record ParsedPeriod(int year, int subPeriod) {

    public static ParsedPeriod ofYear(int year) {
        return new ParsedPeriod(year, 0);
    }
}
