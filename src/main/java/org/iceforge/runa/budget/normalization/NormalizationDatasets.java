package org.iceforge.runa.budget.normalization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of {@code normalization-datasets.yml}: one {@link FactorSeries} per dimension.
 */
public class NormalizationDatasets {

    public static final String CPI = "cpi";
    public static final String EUR = "eur";
    public static final String USD = "usd";
    public static final String GDP = "gdp";
    public static final String POPULATION = "population";

    public static final List<String> REQUIRED_DIMENSIONS = List.of(CPI, EUR, USD, GDP, POPULATION);

    private String version;
    private Map<String, FactorSeries> dimensions = new LinkedHashMap<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Map<String, FactorSeries> getDimensions() {
        return dimensions;
    }

    public void setDimensions(Map<String, FactorSeries> dimensions) {
        this.dimensions = dimensions;
    }

    public FactorSeries dimension(String name) {
        return dimensions == null ? null : dimensions.get(name);
    }
}
