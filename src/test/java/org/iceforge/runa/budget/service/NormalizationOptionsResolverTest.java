package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Currency;
import org.iceforge.runa.budget.model.NormalizationMode;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizationOptionsResolverTest {

    @Test
    void defaultsToNominalRonTotals() {
        assertThat(NormalizationOptionsResolver.resolve(new AnalyticsFilter(), null, null, null))
                .isEqualTo(TransformationOptions.defaults());
        assertThat(NormalizationOptionsResolver.resolve(null, null, null, null))
                .isEqualTo(TransformationOptions.defaults());
    }

    @Test
    void requestLevelValuesWinOverFilter() {
        AnalyticsFilter filter = new AnalyticsFilter();
        filter.setNormalization(NormalizationMode.TOTAL);
        filter.setCurrency(Currency.USD);
        filter.setInflationAdjusted(true);

        assertThat(NormalizationOptionsResolver.resolve(filter, NormalizationMode.PER_CAPITA, Currency.EUR, false))
                .isEqualTo(new TransformationOptions(false, Currency.EUR, true, false));
        assertThat(NormalizationOptionsResolver.resolve(filter, null, null, null))
                .isEqualTo(new TransformationOptions(true, Currency.USD, false, false));
    }

    @Test
    void legacyEuroModesForceEur() {
        assertThat(NormalizationOptionsResolver.resolve(null, NormalizationMode.PER_CAPITA_EURO, Currency.USD, true))
                .isEqualTo(new TransformationOptions(true, Currency.EUR, true, false));
        assertThat(NormalizationOptionsResolver.resolve(null, NormalizationMode.TOTAL_EURO, null, null))
                .isEqualTo(new TransformationOptions(false, Currency.EUR, false, false));
    }

    @Test
    void percentGdpDropsInflationAndCurrency() {
        assertThat(NormalizationOptionsResolver.resolve(null, NormalizationMode.PERCENT_GDP, Currency.EUR, true))
                .isEqualTo(new TransformationOptions(false, Currency.RON, false, true));
    }

    @Test
    void periodGrowthPrefersRequestFlag() {
        AnalyticsFilter filter = new AnalyticsFilter();
        filter.setShowPeriodGrowth(true);

        assertThat(NormalizationOptionsResolver.periodGrowth(filter, null)).isTrue();
        assertThat(NormalizationOptionsResolver.periodGrowth(filter, false)).isFalse();
        assertThat(NormalizationOptionsResolver.periodGrowth(null, null)).isFalse();
    }
}
