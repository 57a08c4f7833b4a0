package com.jay.carbonscore.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.carbonscore.EngineFixtures;
import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.layer1_data.QuestionnaireValidator;
import com.jay.carbonscore.layer1_data.SectorBenchmarkTable;
import com.jay.carbonscore.layer2_analysis.BenchmarkAnalyzer;
import com.jay.carbonscore.layer2_analysis.ScopeCalculator;
import com.jay.carbonscore.layer3_kpi.KpiSynthesizer;
import com.jay.carbonscore.layer4_recommendation.RecommendationRanker;
import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.CompanyData;
import com.jay.carbonscore.model.enums.CalculationStage;
import com.jay.carbonscore.model.enums.SustainabilityGrade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CarbonFootprintServiceTest {

    private final CarbonFootprintService service = EngineFixtures.service();
    private final ObjectMapper mapper = new ObjectMapper();

    private static CompanyData mixed() {
        return CompanyData.builder()
            .companyName("Transports Leroy")
            .sector("transport")
            .employeeBand("50-249")
            .revenue(4_200_000.0)
            .electricityKwh(60_000)
            .gasKwh(25_000)
            .fuelLitres(30_000)
            .vehicleKm(180_000)
            .domesticFlightKm(4_000)
            .purchaseAmount(250_000)
            .localSourcingPct(35)
            .build();
    }

    @Test
    void electricityOnlyExample() {
        CarbonFootprintResult result = service.calculate(EngineFixtures.electricityOnly());

        assertThat(result.getScope1Kg()).isEqualTo(0.0);
        assertThat(result.getScope2Kg()).isEqualTo(571.0);
        assertThat(result.getScope3Kg()).isEqualTo(134.0);
        assertThat(result.getTotalKg()).isEqualTo(705.0);
        assertThat(result.getUnattributedUpstreamKg()).isEqualTo(134.0);
        assertThat(result.getBreakdown()).containsEntry("electricity", 571.0).containsEntry("purchases", 0.0);
        assertThat(result.getEmployeeCount()).isEqualTo(25);
        assertThat(result.getEmployeeBand()).isEqualTo("10-49");
        assertThat(result.getIntensityPerEmployeeKg()).isEqualTo(28.2);
        assertThat(result.getBenchmarkPosition()).isEqualTo("top quartile");
        assertThat(result.getBenchmarkPercentile()).isEqualTo(25);
        assertThat(result.getKpis().getEfficiencyScore()).isEqualTo(100.0);
        assertThat(result.getKpis().getGrade()).isEqualTo(SustainabilityGrade.A_PLUS);
        assertThat(result.getFactorSource()).isEqualTo("ADEME Base Carbone v17");
    }

    @Test
    void breakdownKeysAreFixed() {
        CarbonFootprintResult result = service.calculate(mixed());

        assertThat(result.getBreakdown().keySet()).containsExactly("electricity", "gas", "fuel", "vehicles",
            "domestic_flights", "international_flights", "purchases");
    }

    @Test
    void residualBoundsBreakdownDiscrepancy() {
        CarbonFootprintResult result = service.calculate(mixed());

        double breakdownSum = result.getBreakdown().values().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(result.getTotalKg() - breakdownSum)
            .isCloseTo(result.getUnattributedUpstreamKg(), within(0.05));
        assertThat(result.getUnattributedUpstreamKg()).isCloseTo(60_000 * 0.0134 + 25_000 * 0.0456, within(0.01));
    }

    @Test
    void displayedScopesAndMonthsAddUpToDisplayedTotal() {
        for (int kwh = 1; kwh <= 2_000; kwh++) {
            CarbonFootprintResult result = service.calculate(EngineFixtures.electricityOnly().toBuilder()
                .electricityKwh(kwh)
                .gasKwh(3.0 * kwh)
                .vehicleKm(2.0 * kwh)
                .build());

            BigDecimal total = BigDecimal.valueOf(result.getTotalKg());
            BigDecimal scopes = BigDecimal.valueOf(result.getScope1Kg())
                .add(BigDecimal.valueOf(result.getScope2Kg()))
                .add(BigDecimal.valueOf(result.getScope3Kg()));
            BigDecimal months = result.getKpis().getMonthly().stream()
                .map(m -> BigDecimal.valueOf(m.emissionsKg()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

            assertThat(scopes).as("scopes at %d kWh", kwh).isEqualByComparingTo(total);
            assertThat(months).as("months at %d kWh", kwh).isEqualByComparingTo(total);
            assertThat(result.getKpis().getMonthly()).allSatisfy(m -> assertThat(m.emissionsKg()).isNotNegative());
            assertThat(result.getKpis().getTrajectory().currentKg()).isEqualTo(result.getTotalKg());
        }
    }

    @Test
    void actionsAreCappedAndSortedByImpact() {
        CarbonFootprintResult result = service.calculate(mixed());

        assertThat(result.getActions()).isNotEmpty().hasSizeLessThanOrEqualTo(8);
        assertThat(result.getRecommendations()).hasSameSizeAs(result.getActions());
        for (int i = 1; i < result.getActions().size(); i++) {
            assertThat(result.getActions().get(i - 1).impactKg())
                .isGreaterThanOrEqualTo(result.getActions().get(i).impactKg());
        }
    }

    @Test
    void revenueIntensityIsPerThousandEuros() {
        CarbonFootprintResult result = service.calculate(EngineFixtures.electricityOnly().toBuilder()
            .revenue(500_000.0).build());

        assertThat(result.getIntensityPerRevenue()).isEqualTo(1.41);
    }

    @Test
    void missingRevenueIsOmittedFromJson() throws Exception {
        CarbonFootprintResult noRevenue = service.calculate(EngineFixtures.electricityOnly());
        CarbonFootprintResult zeroRevenue = service.calculate(EngineFixtures.electricityOnly().toBuilder()
            .revenue(0.0).build());

        assertThat(noRevenue.getIntensityPerRevenue()).isNull();
        assertThat(zeroRevenue.getIntensityPerRevenue()).isNull();
        assertThat(mapper.writeValueAsString(noRevenue)).doesNotContain("intensityPerRevenue");
    }

    @Test
    void identicalInputsGiveByteIdenticalJson() throws Exception {
        String first = mapper.writeValueAsString(service.calculate(mixed()));
        String second = mapper.writeValueAsString(service.calculate(mixed()));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void unknownSectorDoesNotRaise() {
        CarbonFootprintResult result = service.calculate(mixed().toBuilder().sector("unknown_sector").build());

        assertThat(result.isSectorFallback()).isTrue();
        assertThat(result.getSector()).isEqualTo("services");
        assertThat(result.getKpis().getEfficiencyScore()).isBetween(0.0, 100.0);
        assertThat(result.getKpis().getGrade()).isNotNull();
    }

    @Test
    void unknownEmployeeBandMeansTwentyFive() {
        CarbonFootprintResult result = service.calculate(EngineFixtures.electricityOnly().toBuilder()
            .employeeBand("a few").build());

        assertThat(result.getEmployeeCount()).isEqualTo(25);
        assertThat(result.getEmployeeBand()).isEqualTo("10-49");
    }

    @Test
    void invalidInputFailsValidationStage() {
        CompanyData invalid = EngineFixtures.electricityOnly().toBuilder().gasKwh(-5).build();

        assertThatThrownBy(() -> service.calculate(invalid))
            .isInstanceOf(CalculationException.class)
            .satisfies(e -> assertThat(((CalculationException) e).getStage()).isEqualTo(CalculationStage.VALIDATION))
            .hasMessageContaining("gas_kwh");
    }

    @Test
    void failingStageIsReportedWithoutPartialResult() {
        EngineConfig config = EngineFixtures.config();
        SectorBenchmarkTable sectors = new SectorBenchmarkTable(config);
        KpiSynthesizer failingKpis = mock(KpiSynthesizer.class);
        when(failingKpis.synthesize(any(), any(), anyDouble(), anyInt(), any()))
            .thenThrow(new IllegalStateException("seasonal weights missing"));
        CarbonFootprintService broken = new CarbonFootprintService(config, new QuestionnaireValidator(),
            new ScopeCalculator(EngineFixtures.factors()), new BenchmarkAnalyzer(sectors),
            new RecommendationRanker(config, sectors), failingKpis);

        assertThatThrownBy(() -> broken.calculate(mixed()))
            .isInstanceOf(CalculationException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(((CalculationException) e).getStage()).isEqualTo(CalculationStage.KPIS));
    }
}
