package com.jay.carbonscore.model;

import com.jay.carbonscore.util.Rounding;

/**
 * One line of the calculation trace: quantity x factor = emission, attributed to a scope.
 */
public record TraceEntry(
    String source,
    double quantity,
    String unit,
    double factor,
    double emissionKg,
    int scope
) {
    public TraceEntry rounded() {
        return new TraceEntry(source, quantity, unit, factor, Rounding.mass(emissionKg), scope);
    }
}
