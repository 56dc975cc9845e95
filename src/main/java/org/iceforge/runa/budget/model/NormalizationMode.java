package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Normalization requested by callers. {@code total_euro} and {@code per_capita_euro} are legacy
 * shortcuts that imply EUR.
 */
public enum NormalizationMode {
    TOTAL("total"),
    PER_CAPITA("per_capita"),
    PERCENT_GDP("percent_gdp"),
    TOTAL_EURO("total_euro"),
    PER_CAPITA_EURO("per_capita_euro");

    private final String value;

    NormalizationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isPerCapita() {
        return this == PER_CAPITA || this == PER_CAPITA_EURO;
    }

    public boolean isLegacyEuro() {
        return this == TOTAL_EURO || this == PER_CAPITA_EURO;
    }

    @JsonCreator
    public static NormalizationMode fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (NormalizationMode m : values()) {
            if (m.value.equals(v)) return m;
        }
        throw new IllegalArgumentException("Unknown normalization: " + value);
    }
}
