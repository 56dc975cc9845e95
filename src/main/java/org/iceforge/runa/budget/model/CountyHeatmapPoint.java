package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CountyHeatmapPoint(String countyCode,
                                 String countyName,
                                 Long countyPopulation,
                                 String countyEntityCui,
                                 double amount,
                                 double totalAmount,
                                 double perCapitaAmount) {
}
