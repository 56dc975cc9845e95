package org.iceforge.runa.budget.model;

import java.util.List;

/**
 * Raw series points plus the population denominator resolved for the filter (null when unknown).
 */
public record SeriesData(List<PeriodAmount> points, Long population) {
}
