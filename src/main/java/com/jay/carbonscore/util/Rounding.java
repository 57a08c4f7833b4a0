package com.jay.carbonscore.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output precision applied at the orchestrator boundary:
 * 2 decimals for kgCO2e and euros, 1 decimal for scores and equivalent counts.
 */
public final class Rounding {

    private Rounding() {
    }

    public static double mass(double value)  { return round(value, 2); }
    public static double score(double value) { return round(value, 1); }

    public static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            throw new IllegalStateException("Non-finite value cannot be rounded: " + value);
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /** Rounds every value to 2 decimals, keeping key order. */
    public static Map<String, Double> mass(Map<String, Double> values) {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, mass(v)));
        return Collections.unmodifiableMap(out);
    }

    /** Exact decimal sum of values that are already rounded. */
    public static double sum(double... values) {
        BigDecimal total = BigDecimal.ZERO;
        for (double value : values) {
            total = total.add(BigDecimal.valueOf(value));
        }
        return total.doubleValue();
    }

    /**
     * Rounds {@code parts} to 2 decimals so that they add up exactly to {@code total}.
     * Each part is rounded on its running sum, capped at the total; the last part takes what is left.
     */
    public static List<Double> massParts(List<Double> parts, double total) {
        if (parts.isEmpty()) {
            return List.of();
        }
        BigDecimal target = BigDecimal.valueOf(mass(total));
        BigDecimal raw = BigDecimal.ZERO;
        BigDecimal allocated = BigDecimal.ZERO;
        List<Double> out = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size() - 1; i++) {
            raw = raw.add(BigDecimal.valueOf(parts.get(i)));
            BigDecimal upTo = raw.setScale(2, RoundingMode.HALF_UP).min(target).max(allocated);
            out.add(upTo.subtract(allocated).doubleValue());
            allocated = upTo;
        }
        out.add(target.subtract(allocated).doubleValue());
        return Collections.unmodifiableList(out);
    }
}
