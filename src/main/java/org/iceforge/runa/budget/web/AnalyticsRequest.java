package org.iceforge.runa.budget.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Currency;
import org.iceforge.runa.budget.model.NormalizationMode;

/**
 * Body of the heatmap endpoints. Normalization fields here take precedence over the same
 * fields inside {@code filter}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyticsRequest {

    @NotNull
    @Valid
    private AnalyticsFilter filter;

    private NormalizationMode normalization;

    private Currency currency;

    private Boolean inflationAdjusted;

    public AnalyticsFilter getFilter() {
        return filter;
    }

    public void setFilter(AnalyticsFilter filter) {
        this.filter = filter;
    }

    public NormalizationMode getNormalization() {
        return normalization;
    }

    public void setNormalization(NormalizationMode normalization) {
        this.normalization = normalization;
    }

    public Currency getCurrency() {
        return currency;
    }

    public void setCurrency(Currency currency) {
        this.currency = currency;
    }

    public Boolean getInflationAdjusted() {
        return inflationAdjusted;
    }

    public void setInflationAdjusted(Boolean inflationAdjusted) {
        this.inflationAdjusted = inflationAdjusted;
    }
}
