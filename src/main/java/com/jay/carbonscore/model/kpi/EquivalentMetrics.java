package com.jay.carbonscore.model.kpi;

import com.jay.carbonscore.util.Rounding;

public record EquivalentMetrics(
    double treesToPlant,
    double carsOffRoad,
    double homesEnergyYear,
    double flightsParisNewYork
) {
    public EquivalentMetrics rounded() {
        return new EquivalentMetrics(
            Rounding.score(treesToPlant),
            Rounding.score(carsOffRoad),
            Rounding.score(homesEnergyYear),
            Rounding.score(flightsParisNewYork));
    }
}
