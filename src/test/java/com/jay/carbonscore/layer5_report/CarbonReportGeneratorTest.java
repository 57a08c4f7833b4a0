package com.jay.carbonscore.layer5_report;

import com.jay.carbonscore.EngineFixtures;
import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.CompanyData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CarbonReportGeneratorTest {

    private final CarbonReportGenerator generator = new CarbonReportGenerator();

    @Test
    void rendersScopesBreakdownAndActions() {
        CarbonFootprintResult result = EngineFixtures.service().calculate(EngineFixtures.electricityOnly());

        String report = generator.generate(result);

        assertThat(report)
            .contains("CARBON FOOTPRINT REPORT")
            .contains("Atelier Dupont")
            .contains("TOTAL             :  705.00 kgCO2e/yr")
            .contains("SCOPE 2 (energy)  :  571.00 kgCO2e")
            .contains("upstream (unassigned)")
            .contains("top quartile")
            .contains("[A+]")
            .contains("PRIORITY ACTIONS:")
            .contains("1. Green electricity tariff")
            .doesNotContain("PER k€ REVENUE");
    }

    @Test
    void flagsUnknownSectorAndEmptyActionList() {
        CompanyData data = CompanyData.builder().sector("unknown_sector").revenue(100_000.0).build();
        CarbonFootprintResult result = EngineFixtures.service().calculate(data);

        String report = generator.generate(result);

        assertThat(report)
            .contains("Unnamed company")
            .contains("(declared sector unknown)")
            .contains("No priority actions identified.")
            .contains("PER k€ REVENUE    :  0.0000 kgCO2e");
    }
}
