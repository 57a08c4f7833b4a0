package com.jay.carbonscore.config;

import com.jay.carbonscore.EngineFixtures;
import com.jay.carbonscore.model.enums.SectorTrait;
import com.jay.carbonscore.model.enums.StrategicAction;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EngineConfigTest {

    @Test
    void loadsBundledConfiguration() {
        EngineConfig config = EngineFixtures.config();

        assertThat(config.factorSource()).isEqualTo("ADEME Base Carbone v17");
        assertThat(config.factors()).hasSize(13).containsEntry("electricity_grid", 0.0571);
        assertThat(config.defaultSector()).isEqualTo("services");
        assertThat(config.sectors()).hasSize(9)
            .containsKeys("manufacturing", "logistics", "food_service", "technology");
    }

    @Test
    void mapsSnakeCaseSectorFields() {
        EngineConfig.Sector logistics = EngineFixtures.config().sectors().get("logistics");

        assertThat(logistics.getPerEmployeeAverage()).isEqualTo(22.3);
        assertThat(logistics.getPercentile25()).isEqualTo(16.8);
        assertThat(logistics.getPercentile75()).isEqualTo(29.5);
        assertThat(logistics.getTransportWeight()).isEqualTo(0.75);
        assertThat(logistics.getTraits()).contains(SectorTrait.FREIGHT_CARRIER, SectorTrait.FLEET_OPERATOR);
        assertThat(logistics.getStrategicAction()).isEqualTo(StrategicAction.MODAL_SHIFT);
        assertThat(logistics.getAliases()).containsExactly("logistique");
    }

    @Test
    void mapsKpiAndRecommendationSections() {
        EngineConfig config = EngineFixtures.config();

        assertThat(config.kpi().getBcorpMinScore()).isEqualTo(80);
        assertThat(config.kpi().getParisNewYorkFlightTonnes()).isEqualTo(1.8);
        assertThat(config.recommendation().getGreenTariff()).isEqualTo(0.65);
        assertThat(config.recommendation().getEvInvestmentPerVehicle()).isEqualTo(35_000);
        assertThat(config.recommendation().getFleetLitresPerKm()).isEqualTo(0.06);
    }

    @Test
    void seasonalWeightsSumToTwelve() {
        double sum = 0;
        for (double w : EngineFixtures.config().kpi().getSeasonalWeights()) {
            sum += w;
        }
        assertThat(sum).isCloseTo(12.0, within(1e-9));
    }

    @Test
    void normalisesWeightsThatDoNotSumToTwelve() {
        List<Double> weights = EngineConfig.normaliseSeasonalWeights(Collections.nCopies(12, 2.0));

        assertThat(weights).hasSize(12).allSatisfy(w -> assertThat(w).isCloseTo(1.0, within(1e-12)));
    }

    @Test
    void rejectsMalformedWeightVectors() {
        assertThat(EngineConfig.normaliseSeasonalWeights(List.of(1.0, 2.0)))
            .isEqualTo(EngineConfig.Kpi.DEFAULT_SEASONAL_WEIGHTS);
        assertThat(EngineConfig.normaliseSeasonalWeights(Collections.nCopies(12, 0.0)))
            .isEqualTo(EngineConfig.Kpi.DEFAULT_SEASONAL_WEIGHTS);
        assertThat(EngineConfig.normaliseSeasonalWeights(null))
            .isEqualTo(EngineConfig.Kpi.DEFAULT_SEASONAL_WEIGHTS);
    }

    @Test
    void missingFileKeepsInCodeDefaults() {
        EngineConfig config = new EngineConfig();
        ReflectionTestUtils.setField(config, "configFile", "does-not-exist.yaml");
        config.load();

        assertThat(config.sectors()).containsOnlyKeys("services");
        assertThat(config.factors()).hasSize(13);
        assertThat(config.recommendation().getMaxActions()).isEqualTo(8);
    }
}
