package com.jay.carbonscore.model.kpi;

import com.jay.carbonscore.util.Rounding;

/**
 * Company footprint against its sector, scaled to the company's headcount (kgCO2e).
 */
public record PeerComparison(
    int percentile,
    double sectorAverageKg,
    double bestInClassKg,
    double improvementNeededKg
) {
    public PeerComparison rounded() {
        return new PeerComparison(percentile,
            Rounding.mass(sectorAverageKg),
            Rounding.mass(bestInClassKg),
            Rounding.mass(improvementNeededKg));
    }
}
