package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntityAnalyticsPoint(String entityCui,
                                   String entityName,
                                   String entityType,
                                   String uatId,
                                   String countyCode,
                                   String countyName,
                                   Long population,
                                   double amount,
                                   double totalAmount,
                                   double perCapitaAmount) {
}
