package com.jay.carbonscore.model;

import com.jay.carbonscore.model.enums.SectorTrait;
import com.jay.carbonscore.model.enums.StrategicAction;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Sector reference figures. Per-employee figures are tCO2e per employee per year.
 */
@Value
@Builder
public class SectorProfile {

    private String code;
    private String label;

    private double perEmployeeAverage;
    private double revenueIntensity;
    private double percentile25;
    private double percentile75;
    private double transportWeight;   // share of a typical footprint coming from transport

    private Set<SectorTrait> traits;
    private StrategicAction strategicAction;

    public boolean has(SectorTrait trait) {
        return traits != null && traits.contains(trait);
    }
}
