package org.iceforge.runa.budget.service;

import org.iceforge.runa.budget.config.AnalyticsProperties;
import org.iceforge.runa.budget.model.AnalyticsFilter;
import org.iceforge.runa.budget.model.Currency;
import org.iceforge.runa.budget.model.EntityAnalyticsPage;
import org.iceforge.runa.budget.model.EntityAnalyticsPoint;
import org.iceforge.runa.budget.model.EntityAnalyticsSort;
import org.iceforge.runa.budget.model.EntityAnalyticsSort.Direction;
import org.iceforge.runa.budget.model.EntityAnalyticsSort.Field;
import org.iceforge.runa.budget.model.EntityYearAmount;
import org.iceforge.runa.budget.model.Frequency;
import org.iceforge.runa.budget.model.NormalizationFactors;
import org.iceforge.runa.budget.model.PeriodSelection;
import org.iceforge.runa.budget.model.ReportPeriod;
import org.iceforge.runa.budget.model.TransformationOptions;
import org.iceforge.runa.budget.normalization.NormalizationFactorProvider;
import org.iceforge.runa.budget.repository.EntityAnalyticsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityAnalyticsServiceTest {

    @Mock
    EntityAnalyticsRepository repository;

    @Mock
    NormalizationFactorProvider factorProvider;

    EntityAnalyticsService service;
    AnalyticsFilter filter;

    @BeforeEach
    void setUp() {
        AnalyticsProperties props = new AnalyticsProperties();
        props.setEntityDefaultLimit(2);
        props.setEntityMaxLimit(3);
        service = new EntityAnalyticsService(repository, new TransformationPipeline(),
                new UseCaseSupport(factorProvider), props);

        filter = new AnalyticsFilter();
        filter.setReportType("Executie bugetara detaliata");
        // Monthly filter; entity rows are yearly so factors are still requested per year
        filter.setReportPeriod(new ReportPeriod(Frequency.MONTH, PeriodSelection.interval("2024-01", "2024-12")));
    }

    @Test
    void defaultPageIsSortedByTotalDescending() {
        stubRows();

        StepVerifier.create(service.getEntityAnalytics(filter, TransformationOptions.defaults(), null, null, null))
                .assertNext(result -> {
                    EntityAnalyticsPage page = result.getValue();
                    assertThat(page.nodes()).extracting(EntityAnalyticsPoint::entityCui).containsExactly("C", "A");
                    assertThat(page.totalCount()).isEqualTo(4);
                    assertThat(page.hasNextPage()).isTrue();
                    assertThat(page.hasPreviousPage()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void limitIsClampedAndOffsetApplied() {
        stubRows();

        StepVerifier.create(service.getEntityAnalytics(filter, TransformationOptions.defaults(),
                        new EntityAnalyticsSort(Field.ENTITY_NAME, Direction.ASC), 50, 1))
                .assertNext(result -> {
                    EntityAnalyticsPage page = result.getValue();
                    assertThat(page.nodes()).extracting(EntityAnalyticsPoint::entityName).containsExactly("Beta", "Gamma", "Zeta");
                    assertThat(page.hasNextPage()).isFalse();
                    assertThat(page.hasPreviousPage()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void perCapitaModeRanksByPerCapitaAmount() {
        stubRows();

        StepVerifier.create(service.getEntityAnalytics(filter, new TransformationOptions(false, Currency.RON, true),
                        new EntityAnalyticsSort(Field.PER_CAPITA_AMOUNT, Direction.DESC), 3, 0))
                .assertNext(result -> {
                    List<EntityAnalyticsPoint> nodes = result.getValue().nodes();
                    assertThat(nodes).extracting(EntityAnalyticsPoint::entityCui).containsExactly("B", "A", "D");
                    assertThat(nodes.get(0).amount()).isEqualTo(nodes.get(0).perCapitaAmount());
                    assertThat(nodes.get(0).uatId()).isEqualTo("7");
                })
                .verifyComplete();
    }

    @Test
    void missingReportTypeIsRejected() {
        filter.setReportType(null);

        StepVerifier.create(service.getEntityAnalytics(filter, TransformationOptions.defaults(), null, 10, 0))
                .assertNext(result -> assertThat(result.getError().getKind())
                        .isEqualTo(AnalyticsError.Kind.MISSING_REQUIRED_FILTER))
                .verifyComplete();

        verifyNoInteractions(repository, factorProvider);
    }

    @Test
    void aggregateThresholdsFilterBeforeCounting() {
        filter.setAggregateMinAmount(new BigDecimal("150"));
        filter.setAggregateMaxAmount(new BigDecimal("500"));

        EntityAnalyticsPage page = EntityAnalyticsService.page(List.of(
                        total("A", "Alpha", "100"),
                        total("B", "Beta", "150"),
                        total("C", "Gamma", "500"),
                        total("D", "Delta", "501")),
                filter, EntityAnalyticsSort.DEFAULT, 10, 0);

        assertThat(page.nodes()).extracting(EntityAnalyticsPoint::entityCui).containsExactly("C", "B");
        assertThat(page.totalCount()).isEqualTo(2);
    }

    @Test
    void tiesBreakOnEntityCui() {
        EntityAnalyticsPage page = EntityAnalyticsService.page(List.of(
                        total("Z", "Same", "10"),
                        total("M", "Same", "10"),
                        total("A", "Same", "10")),
                filter, new EntityAnalyticsSort(Field.AMOUNT, Direction.DESC), 10, 0);

        assertThat(page.nodes()).extracting(EntityAnalyticsPoint::entityCui).containsExactly("A", "M", "Z");
    }

    @Test
    void nullsSortLastInBothDirections() {
        List<NormalizedTotal<EntityYearAmount>> totals = List.of(
                new NormalizedTotal<>(row("A", "Alpha", null, null, 2024, "1"), BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ONE),
                new NormalizedTotal<>(row("B", "Beta", null, 5L, 2024, "1"), BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ONE),
                new NormalizedTotal<>(row("C", "Gamma", null, 9L, 2024, "1"), BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ONE));

        assertThat(EntityAnalyticsService.page(totals, filter, new EntityAnalyticsSort(Field.POPULATION, Direction.ASC), 10, 0).nodes())
                .extracting(EntityAnalyticsPoint::entityCui).containsExactly("B", "C", "A");
        assertThat(EntityAnalyticsService.page(totals, filter, new EntityAnalyticsSort(Field.POPULATION, Direction.DESC), 10, 0).nodes())
                .extracting(EntityAnalyticsPoint::entityCui).containsExactly("C", "B", "A");
    }

    private void stubRows() {
        when(repository.getYearlyAmounts(filter)).thenReturn(Mono.just(List.of(
                row("A", "Alpha", null, 1_000L, 2023, "300"),
                row("A", "Alpha", null, 1_000L, 2024, "500"),
                row("B", "Beta", 7L, 10L, 2024, "600"),
                row("C", "Gamma", null, null, 2024, "900"),
                row("D", "Zeta", null, 100_000L, 2024, "50"))));
        when(factorProvider.generateFactors(Frequency.YEAR, 2023, 2024)).thenReturn(Mono.just(new NormalizationFactors(
                Map.of(), Map.of(), Map.of(), Map.of(), Map.of())));
    }

    private static EntityYearAmount row(String cui, String name, Long uatId, Long population, int year, String amount) {
        return new EntityYearAmount(cui, name, "admin_town_hall", uatId, "AB", "Alba", population, year, new BigDecimal(amount));
    }

    private static NormalizedTotal<EntityYearAmount> total(String cui, String name, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return new NormalizedTotal<>(row(cui, name, null, null, 2024, amount), value, BigDecimal.ZERO, value);
    }
}
