package com.jay.carbonscore.model.enums;

/**
 * Fixed breakdown categories. Every breakdown carries all seven keys, in this order.
 */
public enum EmissionCategory {
    ELECTRICITY("electricity", "Electricity"),
    GAS("gas", "Natural gas"),
    FUEL("fuel", "Fuel"),
    VEHICLES("vehicles", "Vehicle fleet"),
    DOMESTIC_FLIGHTS("domestic_flights", "Domestic flights"),
    INTERNATIONAL_FLIGHTS("international_flights", "International flights"),
    PURCHASES("purchases", "Purchases");

    private final String code;
    private final String label;

    EmissionCategory(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code()  { return code; }
    public String label() { return label; }

    public boolean isFlight() {
        return this == DOMESTIC_FLIGHTS || this == INTERNATIONAL_FLIGHTS;
    }

    /** Categories counted in a company's transport share. */
    public boolean isTransport() {
        return this == FUEL || this == VEHICLES || isFlight();
    }
}
