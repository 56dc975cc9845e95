package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * Multi-dimensional filter over execution line items.
 *
 * Absent fields (null or empty lists) never produce a condition. {@code reportType} is optional
 * here but required by the aggregation services.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyticsFilter {

    @NotNull
    private AccountCategory accountCategory;

    @NotNull
    @Valid
    private ReportPeriod reportPeriod;

    private String reportType;
    private String mainCreditorCui;

    private List<String> reportIds;
    private List<String> entityCuis;
    private List<String> fundingSourceIds;
    private List<String> budgetSectorIds;
    private List<String> expenseTypes;

    private List<String> functionalCodes;
    private List<String> functionalPrefixes;
    private List<String> economicCodes;
    private List<String> economicPrefixes;
    private List<String> programCodes;

    private List<String> entityTypes;
    private Boolean isUat;
    private List<String> uatIds;
    private List<String> countyCodes;
    private Long minPopulation;
    private Long maxPopulation;

    private BigDecimal itemMinAmount;
    private BigDecimal itemMaxAmount;
    private BigDecimal aggregateMinAmount;
    private BigDecimal aggregateMaxAmount;

    @Valid
    private ExclusionFilter exclude;

    // Normalization intent nested in the filter; request-level values win over these.
    private NormalizationMode normalization;
    private Currency currency;
    private Boolean inflationAdjusted;
    private Boolean showPeriodGrowth;

    public Frequency frequency() {
        return reportPeriod == null ? null : reportPeriod.getFrequency();
    }

    public AccountCategory getAccountCategory() {
        return accountCategory;
    }

    public void setAccountCategory(AccountCategory accountCategory) {
        this.accountCategory = accountCategory;
    }

    public ReportPeriod getReportPeriod() {
        return reportPeriod;
    }

    public void setReportPeriod(ReportPeriod reportPeriod) {
        this.reportPeriod = reportPeriod;
    }

    public String getReportType() {
        return reportType;
    }

    public void setReportType(String reportType) {
        this.reportType = reportType;
    }

    public String getMainCreditorCui() {
        return mainCreditorCui;
    }

    public void setMainCreditorCui(String mainCreditorCui) {
        this.mainCreditorCui = mainCreditorCui;
    }

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

    public List<String> getFundingSourceIds() {
        return fundingSourceIds;
    }

    public void setFundingSourceIds(List<String> fundingSourceIds) {
        this.fundingSourceIds = fundingSourceIds;
    }

    public List<String> getBudgetSectorIds() {
        return budgetSectorIds;
    }

    public void setBudgetSectorIds(List<String> budgetSectorIds) {
        this.budgetSectorIds = budgetSectorIds;
    }

    public List<String> getExpenseTypes() {
        return expenseTypes;
    }

    public void setExpenseTypes(List<String> expenseTypes) {
        this.expenseTypes = expenseTypes;
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

    public List<String> getProgramCodes() {
        return programCodes;
    }

    public void setProgramCodes(List<String> programCodes) {
        this.programCodes = programCodes;
    }

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<String> entityTypes) {
        this.entityTypes = entityTypes;
    }

    public Boolean getIsUat() {
        return isUat;
    }

    public void setIsUat(Boolean isUat) {
        this.isUat = isUat;
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

    public Long getMinPopulation() {
        return minPopulation;
    }

    public void setMinPopulation(Long minPopulation) {
        this.minPopulation = minPopulation;
    }

    public Long getMaxPopulation() {
        return maxPopulation;
    }

    public void setMaxPopulation(Long maxPopulation) {
        this.maxPopulation = maxPopulation;
    }

    public BigDecimal getItemMinAmount() {
        return itemMinAmount;
    }

    public void setItemMinAmount(BigDecimal itemMinAmount) {
        this.itemMinAmount = itemMinAmount;
    }

    public BigDecimal getItemMaxAmount() {
        return itemMaxAmount;
    }

    public void setItemMaxAmount(BigDecimal itemMaxAmount) {
        this.itemMaxAmount = itemMaxAmount;
    }

    public BigDecimal getAggregateMinAmount() {
        return aggregateMinAmount;
    }

    public void setAggregateMinAmount(BigDecimal aggregateMinAmount) {
        this.aggregateMinAmount = aggregateMinAmount;
    }

    public BigDecimal getAggregateMaxAmount() {
        return aggregateMaxAmount;
    }

    public void setAggregateMaxAmount(BigDecimal aggregateMaxAmount) {
        this.aggregateMaxAmount = aggregateMaxAmount;
    }

    public ExclusionFilter getExclude() {
        return exclude;
    }

    public void setExclude(ExclusionFilter exclude) {
        this.exclude = exclude;
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

    public Boolean getShowPeriodGrowth() {
        return showPeriodGrowth;
    }

    public void setShowPeriodGrowth(Boolean showPeriodGrowth) {
        this.showPeriodGrowth = showPeriodGrowth;
    }
}
