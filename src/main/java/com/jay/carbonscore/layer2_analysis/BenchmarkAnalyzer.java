package com.jay.carbonscore.layer2_analysis;

import com.jay.carbonscore.layer1_data.SectorBenchmarkTable;
import com.jay.carbonscore.model.SectorProfile;
import com.jay.carbonscore.model.enums.BenchmarkPosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 2 — Benchmark Analyzer.
 * Places a footprint within its sector's per-employee distribution.
 * Sector figures are tCO2e per employee, so the kg total is converted to tonnes first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BenchmarkAnalyzer {

    private final SectorBenchmarkTable sectors;

    public record BenchmarkResult(
        BenchmarkPosition position,
        double tonnesPerEmployee,
        SectorProfile profile,
        boolean sectorFallback
    ) {
        public int percentile() { return position.percentile(); }
        public String label()   { return position.label(); }
    }

    public BenchmarkResult analyse(String sector, double totalKg, int employeeCount) {
        boolean known = sectors.find(sector).isPresent();
        SectorProfile profile = sectors.resolve(sector);

        if (employeeCount <= 0) {
            log.warn("Employee count is {} — benchmark position not computed", employeeCount);
            return new BenchmarkResult(BenchmarkPosition.INSUFFICIENT_DATA, 0, profile, !known);
        }

        double perEmployee = totalKg / 1000.0 / employeeCount;
        BenchmarkPosition position = position(perEmployee, profile);
        log.debug("Benchmark [{}]: {} tCO2e/employee → {}", profile.getCode(), perEmployee, position.label());
        return new BenchmarkResult(position, perEmployee, profile, !known);
    }

    /** First satisfied threshold wins: p25, sector average, p75, else below average. */
    public static BenchmarkPosition position(double tonnesPerEmployee, SectorProfile profile) {
        if (tonnesPerEmployee <= profile.getPercentile25())      return BenchmarkPosition.TOP_QUARTILE;
        if (tonnesPerEmployee <= profile.getPerEmployeeAverage()) return BenchmarkPosition.ABOVE_AVERAGE;
        if (tonnesPerEmployee <= profile.getPercentile75())      return BenchmarkPosition.AVERAGE;
        return BenchmarkPosition.BELOW_AVERAGE;
    }
}
