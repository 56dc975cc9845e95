package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UatHeatmapPoint(long uatId,
                              String uatCode,
                              String uatName,
                              String sirutaCode,
                              String countyCode,
                              String countyName,
                              String region,
                              Long population,
                              double amount,
                              double totalAmount,
                              double perCapitaAmount) {
}
