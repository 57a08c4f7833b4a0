package com.jay.carbonscore.layer2_analysis;

import com.jay.carbonscore.EngineFixtures;
import com.jay.carbonscore.model.enums.BenchmarkPosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BenchmarkAnalyzerTest {

    private final BenchmarkAnalyzer analyzer = new BenchmarkAnalyzer(EngineFixtures.sectors());

    // services: p25 2.8, average 4.2, p75 6.9 tCO2e per employee; 25 employees
    @ParameterizedTest
    @CsvSource({
        "50000,  TOP_QUARTILE,  25",
        "70000,  TOP_QUARTILE,  25",
        "100000, ABOVE_AVERAGE, 50",
        "150000, AVERAGE,       75",
        "200000, BELOW_AVERAGE, 90"
    })
    void positionsAgainstSectorDistribution(double totalKg, BenchmarkPosition expected, int percentile) {
        BenchmarkAnalyzer.BenchmarkResult result = analyzer.analyse("services", totalKg, 25);

        assertThat(result.position()).isEqualTo(expected);
        assertThat(result.percentile()).isEqualTo(percentile);
        assertThat(result.sectorFallback()).isFalse();
    }

    @Test
    void convertsKilogramsToTonnesPerEmployee() {
        BenchmarkAnalyzer.BenchmarkResult result = analyzer.analyse("technology", 95_000, 25);

        assertThat(result.tonnesPerEmployee()).isCloseTo(3.8, within(1e-12));
        assertThat(result.label()).isEqualTo("above average");
    }

    @Test
    void zeroEmployeesIsInsufficientData() {
        BenchmarkAnalyzer.BenchmarkResult result = analyzer.analyse("services", 50_000, 0);

        assertThat(result.position()).isEqualTo(BenchmarkPosition.INSUFFICIENT_DATA);
        assertThat(result.label()).isEqualTo("insufficient data");
        assertThat(result.tonnesPerEmployee()).isZero();
    }

    @Test
    void unknownSectorFallsBackToDefaultProfile() {
        BenchmarkAnalyzer.BenchmarkResult result = analyzer.analyse("unknown_sector", 100_000, 25);

        assertThat(result.sectorFallback()).isTrue();
        assertThat(result.profile().getCode()).isEqualTo("services");
        assertThat(result.position()).isEqualTo(BenchmarkPosition.ABOVE_AVERAGE);
    }

    @Test
    void aliasIsNotAFallback() {
        BenchmarkAnalyzer.BenchmarkResult result = analyzer.analyse("commerce", 100_000, 25);

        assertThat(result.sectorFallback()).isFalse();
        assertThat(result.profile().getCode()).isEqualTo("retail");
    }
}
