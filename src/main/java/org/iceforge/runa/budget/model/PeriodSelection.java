package org.iceforge.runa.budget.model;

import java.util.List;

/**
 * Either an interval or a list of discrete periods. When both are present the resulting
 * conditions are ANDed.
 */
public class PeriodSelection {
    private PeriodInterval interval;
    private List<String> dates;

    public static PeriodSelection interval(String start, String end) {
        PeriodSelection s = new PeriodSelection();
        s.setInterval(new PeriodInterval(start, end));
        return s;
    }

    public static PeriodSelection dates(List<String> dates) {
        PeriodSelection s = new PeriodSelection();
        s.setDates(dates);
        return s;
    }

    public PeriodInterval getInterval() {
        return interval;
    }

    public void setInterval(PeriodInterval interval) {
        this.interval = interval;
    }

    public List<String> getDates() {
        return dates;
    }

    public void setDates(List<String> dates) {
        this.dates = dates;
    }
}
