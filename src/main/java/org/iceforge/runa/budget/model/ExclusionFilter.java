package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Negated dimension filters. Values listed here remove matching line items from the result.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExclusionFilter {
    private List<String> reportIds;
    private List<String> entityCuis;
    private List<String> functionalCodes;
    private List<String> functionalPrefixes;
    private List<String> economicCodes;
    private List<String> economicPrefixes;
    private List<String> entityTypes;
    private List<String> uatIds;
    private List<String> countyCodes;

    public List<String> getReportIds() {
        return reportIds;
    }

    public void setReportIds(List<String> reportIds) {
        this.reportIds = reportIds;
    }

    public List<String> getEntityCuis() {
        return entityCuis;
    }

    public void setEntityCuis(List<String> entityCuis) {
        this.entityCuis = entityCuis;
    }

    public List<String> getFunctionalCodes() {
        return functionalCodes;
    }

    public void setFunctionalCodes(List<String> functionalCodes) {
        this.functionalCodes = functionalCodes;
    }

    public List<String> getFunctionalPrefixes() {
        return functionalPrefixes;
    }

    public void setFunctionalPrefixes(List<String> functionalPrefixes) {
        this.functionalPrefixes = functionalPrefixes;
    }

    public List<String> getEconomicCodes() {
        return economicCodes;
    }

    public void setEconomicCodes(List<String> economicCodes) {
        this.economicCodes = economicCodes;
    }

    public List<String> getEconomicPrefixes() {
        return economicPrefixes;
    }

    public void setEconomicPrefixes(List<String> economicPrefixes) {
        this.economicPrefixes = economicPrefixes;
    }

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<String> entityTypes) {
        this.entityTypes = entityTypes;
    }

    public List<String> getUatIds() {
        return uatIds;
    }

    public void setUatIds(List<String> uatIds) {
        this.uatIds = uatIds;
    }

    public List<String> getCountyCodes() {
        return countyCodes;
    }

    public void setCountyCodes(List<String> countyCodes) {
        this.countyCodes = countyCodes;
    }
}
