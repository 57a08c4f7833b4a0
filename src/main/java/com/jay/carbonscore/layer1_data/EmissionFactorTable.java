package com.jay.carbonscore.layer1_data;

import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.model.enums.EmissionFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Layer 1 — Emission Factor Table.
 * Name → kgCO2e-per-unit map, built once from configuration and read-only afterwards.
 * Names outside {@link EmissionFactor} are dropped at load, so every lookup is an
 * exact enum match with a single 0.0 default path.
 */
@Slf4j
@Component
public class EmissionFactorTable implements EmissionFactorProvider {

    private final Map<EmissionFactor, Double> factors;
    private final String source;

    public EmissionFactorTable(EngineConfig config) {
        Map<EmissionFactor, Double> map = new EnumMap<>(EmissionFactor.class);
        config.factors().forEach((name, value) -> {
            Optional<EmissionFactor> factor = EmissionFactor.fromKey(name);
            if (factor.isEmpty()) {
                log.warn("Ignoring unknown emission factor '{}'", name);
            } else if (value == null || !Double.isFinite(value) || value < 0) {
                log.warn("Ignoring invalid value {} for emission factor '{}'", value, name);
            } else {
                map.put(factor.get(), value);
            }
        });
        for (EmissionFactor f : EmissionFactor.values()) {
            if (!map.containsKey(f)) {
                log.warn("No value configured for emission factor '{}' — contributions will be 0", f.key());
            }
        }
        this.factors = Collections.unmodifiableMap(map);
        this.source = config.factorSource();
        log.info("Emission factor table ready: {} factors ({})", factors.size(), source);
    }

    @Override
    public double factor(String name) {
        return EmissionFactor.fromKey(name).map(this::factor).orElse(0.0);
    }

    public double factor(EmissionFactor factor) {
        return factors.getOrDefault(factor, 0.0);
    }

    /** Lookup by (category code, unit code), e.g. ("natural_gas", "kWh"). */
    public double factor(String categoryCode, String unitCode) {
        return EmissionFactor.resolve(categoryCode, unitCode).map(this::factor).orElse(0.0);
    }

    public Map<EmissionFactor, Double> asMap() {
        return factors;
    }

    public String source() {
        return source;
    }
}
