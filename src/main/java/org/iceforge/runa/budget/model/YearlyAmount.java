package org.iceforge.runa.budget.model;

import java.math.BigDecimal;

/**
 * A raw, un-normalized amount for one entity and one calendar year.
 */
public interface YearlyAmount {

    /** Identity used to aggregate rows across years. */
    Object entityKey();

    int year();

    BigDecimal totalAmount();

    /** Denominator for per-capita amounts; may be null. */
    Long population();
}
