package org.iceforge.runa.budget.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.iceforge.runa.budget.model.EntityAnalyticsSort;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EntityAnalyticsRequest extends AnalyticsRequest {

    private EntityAnalyticsSort sort;

    /**
     * Page size. Out-of-range values are clamped rather than rejected.
     */
    private Integer limit;

    private Integer offset;

    public EntityAnalyticsSort getSort() {
        return sort;
    }

    public void setSort(EntityAnalyticsSort sort) {
        this.sort = sort;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }
}
