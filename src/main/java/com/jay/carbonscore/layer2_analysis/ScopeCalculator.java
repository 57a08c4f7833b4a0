package com.jay.carbonscore.layer2_analysis;

import com.jay.carbonscore.layer1_data.EmissionFactorProvider;
import com.jay.carbonscore.model.CompanyData;
import com.jay.carbonscore.model.TraceEntry;
import com.jay.carbonscore.model.enums.EmissionCategory;
import com.jay.carbonscore.model.enums.EmissionFactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2 — Scope Calculator.
 * GHG Protocol scope 1/2/3 totals and the per-category breakdown, in kgCO2e per year.
 *
 * Upstream (well-to-tank) emissions of electricity and gas are counted in scope 3
 * but belong to no breakdown category, so
 * {@code total - sum(breakdown) == upstreamResidual}.
 * Missing inputs and unknown factors contribute 0; nothing here throws for bad data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScopeCalculator {

    private final EmissionFactorProvider factors;

    public record ScopeResult(
        double scope1,
        double scope2,
        double scope3,
        double upstreamResidual,
        List<TraceEntry> trace
    ) {
        public double total() {
            return scope1 + scope2 + scope3;
        }
    }

    public ScopeResult calculate(CompanyData data) {
        List<TraceEntry> trace = new ArrayList<>();

        // ── Scope 1: direct combustion ────────────────────────────────────────
        double scope1 = contribution(trace, "fuel", data.getFuelLitres(), EmissionFactor.PETROL, 1)
            + contribution(trace, "natural_gas", data.getGasKwh(), EmissionFactor.NATURAL_GAS, 1)
            + contribution(trace, "vehicles", data.getVehicleKm(), EmissionFactor.CAR_PETROL, 1);

        // ── Scope 2: purchased electricity ────────────────────────────────────
        double scope2 = contribution(trace, "electricity", data.getElectricityKwh(), EmissionFactor.ELECTRICITY_GRID, 2);

        // ── Scope 3: flights, purchases, upstream energy ──────────────────────
        double flights = contribution(trace, "domestic_flights", data.getDomesticFlightKm(), EmissionFactor.FLIGHT_DOMESTIC, 3)
            + contribution(trace, "international_flights", data.getInternationalFlightKm(), EmissionFactor.FLIGHT_INTERNATIONAL, 3);

        double purchaseAmount = data.getPurchaseAmount();
        double purchaseFactor = purchaseFactor(data);
        double purchases = purchaseAmount * purchaseFactor;
        if (purchases != 0) {
            trace.add(new TraceEntry("purchases", purchaseAmount, EmissionFactor.PURCHASED_GOODS.unit().code(),
                purchaseFactor, purchases, 3));
        }

        double upstream = contribution(trace, "upstream_electricity", data.getElectricityKwh(), EmissionFactor.UPSTREAM_ELECTRICITY, 3)
            + contribution(trace, "upstream_gas", data.getGasKwh(), EmissionFactor.UPSTREAM_GAS, 3);

        double scope3 = flights + purchases + upstream;

        log.debug("Scopes for '{}': scope1={} scope2={} scope3={} (upstream {})",
            data.getCompanyName(), scope1, scope2, scope3, upstream);
        return new ScopeResult(scope1, scope2, scope3, upstream, Collections.unmodifiableList(trace));
    }

    /**
     * Per-category emissions using the same per-unit formulas as the scope totals.
     * Always holds all seven categories, in {@link EmissionCategory} order.
     */
    public Map<EmissionCategory, Double> breakdown(CompanyData data) {
        Map<EmissionCategory, Double> out = new EnumMap<>(EmissionCategory.class);
        out.put(EmissionCategory.ELECTRICITY, data.getElectricityKwh() * factor(EmissionFactor.ELECTRICITY_GRID));
        out.put(EmissionCategory.GAS, data.getGasKwh() * factor(EmissionFactor.NATURAL_GAS));
        out.put(EmissionCategory.FUEL, data.getFuelLitres() * factor(EmissionFactor.PETROL));
        out.put(EmissionCategory.VEHICLES, data.getVehicleKm() * factor(EmissionFactor.CAR_PETROL));
        out.put(EmissionCategory.DOMESTIC_FLIGHTS, data.getDomesticFlightKm() * factor(EmissionFactor.FLIGHT_DOMESTIC));
        out.put(EmissionCategory.INTERNATIONAL_FLIGHTS,
            data.getInternationalFlightKm() * factor(EmissionFactor.FLIGHT_INTERNATIONAL));
        out.put(EmissionCategory.PURCHASES, data.getPurchaseAmount() * purchaseFactor(data));
        return Collections.unmodifiableMap(out);
    }

    // Goods factor discounted by the local share of purchases
    private double purchaseFactor(CompanyData data) {
        double localShare = data.getLocalSourcingPct() / 100.0;
        return factor(EmissionFactor.PURCHASED_GOODS)
            * (1 - localShare * factor(EmissionFactor.LOCAL_SOURCING_REDUCTION));
    }

    private double contribution(List<TraceEntry> trace, String source, double quantity,
                                EmissionFactor factor, int scope) {
        double f = factor(factor);
        double emission = quantity * f;
        if (emission != 0) {
            trace.add(new TraceEntry(source, quantity, factor.unit().code(), f, emission, scope));
        }
        return emission;
    }

    private double factor(EmissionFactor factor) {
        return factors.factor(factor.key());
    }
}
