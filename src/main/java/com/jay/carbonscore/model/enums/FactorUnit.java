package com.jay.carbonscore.model.enums;

public enum FactorUnit {
    KWH("kWh"),
    LITRE("litre"),
    KM("km"),
    EUR("EUR"),
    RATIO("ratio");

    private final String code;

    FactorUnit(String code) { this.code = code; }

    public String code() { return code; }

    public static FactorUnit fromCode(String code) {
        if (code == null) return null;
        for (FactorUnit u : values()) {
            if (u.code.equalsIgnoreCase(code.trim())) return u;
        }
        return null;
    }
}
