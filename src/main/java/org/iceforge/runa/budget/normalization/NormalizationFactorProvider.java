package org.iceforge.runa.budget.normalization;

import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.NormalizationFactors;
import reactor.core.publisher.Mono;

/**
 * Supplies CPI, exchange rate, GDP and population factors keyed by period label at
 * {@code frequency}, covering every period between the two years inclusive.
 */
public interface NormalizationFactorProvider {

    Mono<NormalizationFactors> generateFactors(Frequency frequency, int startYear, int endYear);
}
