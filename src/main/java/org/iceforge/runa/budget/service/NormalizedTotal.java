package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.YearlyAmount;

import java.math.BigDecimal;

/**
 * Normalized cross-year total for one entity. {@code last} is the last raw row seen for the
 * entity and supplies its metadata and population.
 */
public record NormalizedTotal<T extends YearlyAmount>(T last,
                                                      BigDecimal totalAmount,
                                                      BigDecimal perCapitaAmount,
                                                      BigDecimal amount) {
}
