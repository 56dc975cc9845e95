package org.iceforge.runa.budget.model;

import java.math.BigDecimal;

/**
 * Raw amount for one period of a series. {@code subPeriod} is the month or quarter, 0 for yearly
 * series.
 */
public record PeriodAmount(int year, int subPeriod, BigDecimal amount) {
}
