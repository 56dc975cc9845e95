package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AccountCategory {
    /** Expenses (cheltuieli). */
    EXPENSE("ch"),
    /** Income (venituri). */
    INCOME("vn");

    private final String code;

    AccountCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AccountCategory fromCode(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (AccountCategory c : values()) {
            if (c.code.equals(v) || c.name().toLowerCase(Locale.ROOT).equals(v)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown account category: " + value);
    }
}
