package org.iceforge.runa.budget.normalization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.runa.budget.config.AnalyticsProperties;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.NormalizationFactors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Normalization factors read from a YAML dataset file on the classpath. The file is parsed once
 * and validated for the five required dimensions; factor maps are generated per call.
 */
@Component
public class DatasetNormalizationService implements NormalizationFactorProvider {

    private static final Logger log = LoggerFactory.getLogger(DatasetNormalizationService.class);

    private final ObjectMapper yamlMapper;
    private final AnalyticsProperties props;

    private volatile NormalizationDatasets cached;

    public DatasetNormalizationService(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper,
                                       AnalyticsProperties props) {
        this.yamlMapper = Objects.requireNonNull(yamlObjectMapper);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public Mono<NormalizationFactors> generateFactors(Frequency frequency, int startYear, int endYear) {
        return Mono.fromCallable(() -> generate(load(), frequency, startYear, endYear))
                .subscribeOn(Schedulers.boundedElastic());
    }

    static NormalizationFactors generate(NormalizationDatasets datasets, Frequency frequency, int startYear, int endYear) {
        if (startYear > endYear) {
            throw new IllegalArgumentException("startYear " + startYear + " is after endYear " + endYear);
        }
        return new NormalizationFactors(
                FactorMaps.generate(frequency, startYear, endYear, datasets.dimension(NormalizationDatasets.CPI)),
                FactorMaps.generate(frequency, startYear, endYear, datasets.dimension(NormalizationDatasets.EUR)),
                FactorMaps.generate(frequency, startYear, endYear, datasets.dimension(NormalizationDatasets.USD)),
                FactorMaps.generate(frequency, startYear, endYear, datasets.dimension(NormalizationDatasets.GDP)),
                FactorMaps.generate(frequency, startYear, endYear, datasets.dimension(NormalizationDatasets.POPULATION)));
    }

    public NormalizationDatasets load() {
        NormalizationDatasets local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            NormalizationDatasets loaded;
            try (InputStream in = new ClassPathResource(props.getDatasetResource()).getInputStream()) {
                loaded = yamlMapper.readValue(in, NormalizationDatasets.class);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load normalization datasets: " + props.getDatasetResource(), e);
            }
            validate(loaded, props.getDatasetResource());
            log.info("Loaded normalization datasets {} (version {})", props.getDatasetResource(), loaded.getVersion());
            cached = loaded;
            return cached;
        }
    }

    public void reload() {
        cached = null;
    }

    static void validate(NormalizationDatasets datasets, String resource) {
        List<String> missing = new ArrayList<>();
        for (String dimension : NormalizationDatasets.REQUIRED_DIMENSIONS) {
            FactorSeries series = datasets.dimension(dimension);
            if (series == null || series.getYearly().isEmpty()) {
                missing.add(dimension);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Normalization datasets " + resource + " lack yearly values for: " + missing);
        }
    }
}
