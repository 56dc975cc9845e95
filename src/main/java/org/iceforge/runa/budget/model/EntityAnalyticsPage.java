package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EntityAnalyticsPage(List<EntityAnalyticsPoint> nodes,
                                  int totalCount,
                                  boolean hasNextPage,
                                  boolean hasPreviousPage) {
}
