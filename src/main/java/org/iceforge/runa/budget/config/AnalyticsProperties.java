package org.iceforge.runa.budget.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /**
     * Location of the normalization datasets YAML on the classpath.
     */
    @NotBlank
    private String datasetResource = "normalization-datasets.yml";

    /**
     * Per-statement timeout applied to analytics queries. Postgres reports expiry as SQLState 57014.
     */
    @Min(1)
    private int queryTimeoutSeconds = 30;

    /**
     * Upper bound on raw rows fetched by one heatmap or entity query.
     */
    @Min(1)
    private int maxRows = 50_000;

    @Min(0)
    private int entityDefaultLimit = 10;

    @Min(1)
    private int entityMaxLimit = 100_000;

    /**
     * Price year the CPI factors convert to; shown in series units, e.g. {@code RON (real 2024)}.
     */
    @Min(1900)
    private int referenceYear = 2024;

    public String getDatasetResource() {
        return datasetResource;
    }

    public void setDatasetResource(String datasetResource) {
        this.datasetResource = datasetResource;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getEntityDefaultLimit() {
        return entityDefaultLimit;
    }

    public void setEntityDefaultLimit(int entityDefaultLimit) {
        this.entityDefaultLimit = entityDefaultLimit;
    }

    public int getEntityMaxLimit() {
        return entityMaxLimit;
    }

    public void setEntityMaxLimit(int entityMaxLimit) {
        this.entityMaxLimit = entityMaxLimit;
    }

    public int getReferenceYear() {
        return referenceYear;
    }

    public void setReferenceYear(int referenceYear) {
        this.referenceYear = referenceYear;
    }
}
