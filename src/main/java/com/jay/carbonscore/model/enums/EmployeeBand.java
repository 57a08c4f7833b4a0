package com.jay.carbonscore.model.enums;

/**
 * Questionnaire headcount buckets and the midpoint headcount used for intensities.
 * Unrecognised values resolve to {@link #SMALL}.
 */
public enum EmployeeBand {
    MICRO("1-9", 1, 9, 5),
    SMALL("10-49", 10, 49, 25),
    MEDIUM("50-249", 50, 249, 125),
    LARGE("250+", 250, Integer.MAX_VALUE, 500);

    public static final EmployeeBand DEFAULT = SMALL;

    private final String code;
    private final int min;
    private final int max;
    private final int headcount;

    EmployeeBand(String code, int min, int max, int headcount) {
        this.code = code;
        this.min = min;
        this.max = max;
        this.headcount = headcount;
    }

    public String code()   { return code; }
    public int headcount() { return headcount; }

    public static boolean isKnown(String raw) {
        return match(raw) != null;
    }

    public static EmployeeBand resolve(String raw) {
        EmployeeBand band = match(raw);
        return band != null ? band : DEFAULT;
    }

    private static EmployeeBand match(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();
        for (EmployeeBand b : values()) {
            if (b.code.equals(value)) return b;
        }
        // Plain headcount, e.g. "37"
        if (value.length() <= 9 && value.chars().allMatch(Character::isDigit)) {
            int n = Integer.parseInt(value);
            for (EmployeeBand b : values()) {
                if (n >= b.min && n <= b.max) return b;
            }
        }
        return null;
    }
}
