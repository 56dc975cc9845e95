package org.iceforge.runa.budget.model;

import java.math.BigDecimal;

/**
 * Raw county row: one per county per year.
 */
public record HeatmapCountyDataPoint(String countyCode,
                                     String countyName,
                                     Long countyPopulation,
                                     String countyEntityCui,
                                     int year,
                                     BigDecimal totalAmount) implements YearlyAmount {

    @Override
    public Object entityKey() {
        return countyCode;
    }

    @Override
    public Long population() {
        return countyPopulation;
    }
}
