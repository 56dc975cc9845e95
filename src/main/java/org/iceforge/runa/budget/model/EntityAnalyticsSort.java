package org.iceforge.runa.budget.model;

public record EntityAnalyticsSort(Field by, Direction order) {

    public static final EntityAnalyticsSort DEFAULT = new EntityAnalyticsSort(Field.TOTAL_AMOUNT, Direction.DESC);

    public enum Field {
        AMOUNT,
        TOTAL_AMOUNT,
        PER_CAPITA_AMOUNT,
        ENTITY_NAME,
        ENTITY_TYPE,
        POPULATION,
        COUNTY_NAME,
        COUNTY_CODE
    }

    public enum Direction {
        ASC,
        DESC
    }
}
