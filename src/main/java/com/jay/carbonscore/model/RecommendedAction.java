package com.jay.carbonscore.model;

import com.jay.carbonscore.model.enums.EmissionCategory;
import com.jay.carbonscore.util.Rounding;

/**
 * A mitigation action and its quantified impact. Ranking sorts on {@code impactKg},
 * never on the text.
 *
 * @param category        breakdown category the action targets
 * @param action          short action title
 * @param impactKg        estimated annual reduction, kgCO2e
 * @param shareOfTotalPct impact as a percentage of the breakdown total
 * @param text            full human-readable line with cost and timeline hints
 */
public record RecommendedAction(
    EmissionCategory category,
    String action,
    double impactKg,
    double shareOfTotalPct,
    String text
) {
    public RecommendedAction rounded() {
        return new RecommendedAction(category, action,
            Rounding.mass(impactKg), Rounding.score(shareOfTotalPct), text);
    }
}
