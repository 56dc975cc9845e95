package org.iceforge.runa.budget.model;

import java.math.BigDecimal;

/**
 * Raw entity row: one per reporting entity per year.
 */
public record EntityYearAmount(String entityCui,
                               String entityName,
                               String entityType,
                               Long uatId,
                               String countyCode,
                               String countyName,
                               Long population,
                               int year,
                               BigDecimal totalAmount) implements YearlyAmount {

    @Override
    public Object entityKey() {
        return entityCui;
    }
}
