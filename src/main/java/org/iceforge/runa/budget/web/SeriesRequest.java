package org.iceforge.runa.budget.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SeriesRequest extends AnalyticsRequest {

    private Boolean showPeriodGrowth;

    public Boolean getShowPeriodGrowth() {
        return showPeriodGrowth;
    }

    public void setShowPeriodGrowth(Boolean showPeriodGrowth) {
        this.showPeriodGrowth = showPeriodGrowth;
    }
}
