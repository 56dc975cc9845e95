package org.iceforge.runa.budget.model;

/**
 * Inclusive period bounds, both in the lexical format of the report frequency.
 */
public class PeriodInterval {
    private String start;
    private String end;

    public PeriodInterval() {
    }

    public PeriodInterval(String start, String end) {
        this.start = start;
        this.end = end;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }
}
