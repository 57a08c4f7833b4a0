package com.jay.carbonscore.model.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Enumerated emission factors, keyed by (category code, unit code).
 * The key is the name used in carbon-engine.yaml and by
 * {@link com.jay.carbonscore.layer1_data.EmissionFactorProvider}.
 */
public enum EmissionFactor {
    ELECTRICITY_GRID("electricity_grid", "electricity", FactorUnit.KWH),
    NATURAL_GAS("natural_gas", "natural_gas", FactorUnit.KWH),
    PETROL("petrol", "fuel_petrol", FactorUnit.LITRE),
    DIESEL("diesel", "fuel_diesel", FactorUnit.LITRE),
    CAR_PETROL("car_petrol", "vehicle_petrol", FactorUnit.KM),
    CAR_DIESEL("car_diesel", "vehicle_diesel", FactorUnit.KM),
    FLIGHT_DOMESTIC("flight_domestic", "flight_domestic", FactorUnit.KM),
    FLIGHT_INTERNATIONAL("flight_international", "flight_international", FactorUnit.KM),
    PURCHASED_GOODS("purchased_goods", "purchases_goods", FactorUnit.EUR),
    PURCHASED_SERVICES("purchased_services", "purchases_services", FactorUnit.EUR),
    LOCAL_SOURCING_REDUCTION("local_sourcing_reduction", "local_sourcing", FactorUnit.RATIO),
    UPSTREAM_ELECTRICITY("upstream_electricity", "upstream_electricity", FactorUnit.KWH),
    UPSTREAM_GAS("upstream_gas", "upstream_gas", FactorUnit.KWH);

    private final String key;
    private final String categoryCode;
    private final FactorUnit unit;

    EmissionFactor(String key, String categoryCode, FactorUnit unit) {
        this.key = key;
        this.categoryCode = categoryCode;
        this.unit = unit;
    }

    public String key()          { return key; }
    public String categoryCode() { return categoryCode; }
    public FactorUnit unit()     { return unit; }

    public static Optional<EmissionFactor> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (EmissionFactor f : values()) {
            if (f.key.equals(k)) return Optional.of(f);
        }
        return Optional.empty();
    }

    /** Exact match on category code and unit code, both case-insensitive. */
    public static Optional<EmissionFactor> resolve(String categoryCode, String unitCode) {
        FactorUnit unit = FactorUnit.fromCode(unitCode);
        if (categoryCode == null || unit == null) return Optional.empty();
        String c = categoryCode.trim().toLowerCase(Locale.ROOT);
        for (EmissionFactor f : values()) {
            if (f.categoryCode.equals(c) && f.unit == unit) return Optional.of(f);
        }
        return Optional.empty();
    }
}
