package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Normalized time series at the filter frequency. {@code unit} describes the y values,
 * e.g. {@code EUR/capita (real 2024)} or {@code %}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalyticsSeries(Frequency frequency, String unit, List<SeriesPoint> data) {
}
