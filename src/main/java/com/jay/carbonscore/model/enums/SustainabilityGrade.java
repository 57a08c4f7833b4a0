package com.jay.carbonscore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Letter grade from the efficiency score, in fixed 10-point bands. */
public enum SustainabilityGrade {
    A_PLUS("A+", 90),
    A("A", 80),
    B("B", 70),
    C("C", 60),
    D("D", 50),
    F("F", 0);

    private final String label;
    private final double minScore;

    SustainabilityGrade(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String label() { return label; }

    public static SustainabilityGrade fromScore(double score) {
        for (SustainabilityGrade g : values()) {
            if (score >= g.minScore) return g;
        }
        return F;
    }
}
