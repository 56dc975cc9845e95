package org.iceforge.runa.budget.normalization;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw values of one normalization dimension. Only {@code yearly} is required; finer
 * frequencies override it where present.
 */
public class FactorSeries {
    private Map<String, BigDecimal> yearly = new LinkedHashMap<>();
    private Map<String, BigDecimal> quarterly = new LinkedHashMap<>();
    private Map<String, BigDecimal> monthly = new LinkedHashMap<>();

    public FactorSeries() {
    }

    public FactorSeries(Map<String, BigDecimal> yearly,
                        Map<String, BigDecimal> quarterly,
                        Map<String, BigDecimal> monthly) {
        setYearly(yearly);
        setQuarterly(quarterly);
        setMonthly(monthly);
    }

    public static FactorSeries yearly(Map<String, BigDecimal> yearly) {
        return new FactorSeries(yearly, null, null);
    }

    public Map<String, BigDecimal> getYearly() {
        return yearly;
    }

    public void setYearly(Map<String, BigDecimal> yearly) {
        this.yearly = yearly == null ? new LinkedHashMap<>() : yearly;
    }

    public Map<String, BigDecimal> getQuarterly() {
        return quarterly;
    }

    public void setQuarterly(Map<String, BigDecimal> quarterly) {
        this.quarterly = quarterly == null ? new LinkedHashMap<>() : quarterly;
    }

    public Map<String, BigDecimal> getMonthly() {
        return monthly;
    }

    public void setMonthly(Map<String, BigDecimal> monthly) {
        this.monthly = monthly == null ? new LinkedHashMap<>() : monthly;
    }
}
