package com.jay.carbonscore.layer1_data;

/**
 * Emission factor lookup consumed by the scope calculator.
 */
@FunctionalInterface
public interface EmissionFactorProvider {

    /**
     * kgCO2e per physical unit for the named factor (e.g. "electricity_grid").
     * Returns 0.0 for an unknown name, never throws.
     */
    double factor(String name);
}
