package com.jay.carbonscore.model.enums;

public enum BenchmarkPosition {
    TOP_QUARTILE("top quartile", 25),
    ABOVE_AVERAGE("above average", 50),
    AVERAGE("average", 75),
    BELOW_AVERAGE("below average", 90),
    INSUFFICIENT_DATA("insufficient data", 0);

    private final String label;
    private final int percentile;

    BenchmarkPosition(String label, int percentile) {
        this.label = label;
        this.percentile = percentile;
    }

    public String label()   { return label; }
    public int percentile() { return percentile; }
}
