package com.jay.carbonscore.model.kpi;

import com.jay.carbonscore.util.Rounding;

import java.util.List;

/**
 * Reduction pathway: a 55% cut by the target year at a constant annual pace.
 */
public record Trajectory(
    int targetYear,
    double currentKg,
    double targetKg,
    double annualReductionKg,
    double feasibleWithActionsKg,
    List<TrajectoryPoint> path
) {
    /** Copy at output precision, starting from the displayed total. */
    public Trajectory rounded(double roundedCurrentKg) {
        return new Trajectory(targetYear,
            roundedCurrentKg,
            Rounding.mass(targetKg),
            Rounding.mass(annualReductionKg),
            Rounding.mass(feasibleWithActionsKg),
            path.stream()
                .map(p -> new TrajectoryPoint(p.yearOffset(), Rounding.mass(p.emissionsKg())))
                .toList());
    }
}
