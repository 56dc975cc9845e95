package org.iceforge.runa.budget.model;

/**
 * Reporting frequency of execution line items. Each frequency reads its own amount column.
 */
public enum Frequency {
    MONTH("monthly_amount"),
    QUARTER("quarterly_amount"),
    YEAR("ytd_amount");

    private final String amountColumn;

    Frequency(String amountColumn) {
        this.amountColumn = amountColumn;
    }

    public String getAmountColumn() {
        return amountColumn;
    }
}
