package org.iceforge.runa.budget.service;

import java.util.Objects;

/**
 * Which optional joins are present in the query being built, plus the table aliases in use.
 * Entity and UAT filters are only compiled when the matching join is available.
 */
public record SqlBuildContext(boolean hasEntityJoin,
                              boolean hasUatJoin,
                              String lineItemAlias,
                              String entityAlias,
                              String uatAlias) {

    public static final String DEFAULT_LINE_ITEM_ALIAS = "eli";
    public static final String DEFAULT_ENTITY_ALIAS = "e";
    public static final String DEFAULT_UAT_ALIAS = "u";

    public SqlBuildContext {
        Objects.requireNonNull(lineItemAlias, "lineItemAlias");
        Objects.requireNonNull(entityAlias, "entityAlias");
        Objects.requireNonNull(uatAlias, "uatAlias");
    }

    public static SqlBuildContext of(boolean hasEntityJoin, boolean hasUatJoin) {
        return new SqlBuildContext(hasEntityJoin, hasUatJoin,
                DEFAULT_LINE_ITEM_ALIAS, DEFAULT_ENTITY_ALIAS, DEFAULT_UAT_ALIAS);
    }

    public static SqlBuildContext lineItemsOnly() {
        return of(false, false);
    }

    public SqlBuildContext withAliases(String lineItemAlias, String entityAlias, String uatAlias) {
        return new SqlBuildContext(hasEntityJoin, hasUatJoin, lineItemAlias, entityAlias, uatAlias);
    }
}
