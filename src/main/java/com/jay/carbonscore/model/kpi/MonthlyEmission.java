package com.jay.carbonscore.model.kpi;

import com.jay.carbonscore.util.Rounding;

public record MonthlyEmission(int month, double emissionsKg, double weight) {

    /** Copy carrying an already rounded amount; see {@link Rounding#massParts}. */
    public MonthlyEmission rounded(double roundedKg) {
        return new MonthlyEmission(month, roundedKg, Rounding.round(weight, 4));
    }
}
