package org.iceforge.runa.budget.model;

import java.math.BigDecimal;

/**
 * Raw UAT row: one per UAT per year.
 */
public record HeatmapUatDataPoint(long uatId,
                                  String uatCode,
                                  String uatName,
                                  String sirutaCode,
                                  String countyCode,
                                  String countyName,
                                  String region,
                                  Long population,
                                  int year,
                                  BigDecimal totalAmount) implements YearlyAmount {

    @Override
    public Object entityKey() {
        return uatId;
    }
}
