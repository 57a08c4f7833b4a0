package com.jay.carbonscore.layer4_recommendation;

import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.layer1_data.SectorBenchmarkTable;
import com.jay.carbonscore.model.CompanyData;
import com.jay.carbonscore.model.RecommendedAction;
import com.jay.carbonscore.model.SectorProfile;
import com.jay.carbonscore.model.enums.EmissionCategory;
import com.jay.carbonscore.model.enums.SectorTrait;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Layer 4 — Recommendation Ranker.
 * Builds sector-conditioned mitigation actions for the largest emission categories
 * and orders them by estimated impact (kgCO2e/yr), highest first.
 *
 * Only categories in the top five that carry at least 5% of the breakdown are considered.
 * One sector-specific strategic action may be added on top.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationRanker {

    private final EngineConfig config;
    private final SectorBenchmarkTable sectors;

    public List<RecommendedAction> rank(CompanyData data, Map<EmissionCategory, Double> breakdown) {
        EngineConfig.Recommendation cfg = config.recommendation();
        double breakdownTotal = breakdown.values().stream().mapToDouble(Double::doubleValue).sum();
        if (breakdownTotal <= 0) {
            log.debug("Empty breakdown — no recommendations");
            return List.of();
        }

        SectorProfile profile = profileFor(data, breakdown, breakdownTotal);
        List<RecommendedAction> actions = new ArrayList<>();

        // ── Per-category templates ────────────────────────────────────────────
        List<EmissionCategory> retained = breakdown.entrySet().stream()
            .sorted(Map.Entry.<EmissionCategory, Double>comparingByValue().reversed())
            .limit(cfg.getTopCategories())
            .filter(e -> e.getValue() / breakdownTotal * 100 >= cfg.getMinSharePct())
            .map(Map.Entry::getKey)
            .toList();

        for (EmissionCategory category : retained) {
            double emissions = breakdown.get(category);
            switch (category) {
                case ELECTRICITY -> electricity(actions, data, emissions, profile, breakdownTotal);
                case VEHICLES -> vehicles(actions, data, emissions, profile, breakdownTotal);
                case FUEL -> fuel(actions, data, emissions, profile, breakdownTotal);
                case GAS -> gas(actions, data, emissions, profile, breakdownTotal);
                case DOMESTIC_FLIGHTS -> flights(actions, category, data.getDomesticFlightKm(), emissions, breakdownTotal);
                case INTERNATIONAL_FLIGHTS ->
                    flights(actions, category, data.getInternationalFlightKm(), emissions, breakdownTotal);
                case PURCHASES -> purchases(actions, data, emissions, profile, breakdownTotal);
            }
        }

        // ── Sector strategic action ───────────────────────────────────────────
        strategic(actions, data, breakdown, profile, breakdownTotal);

        // List.sort is stable: equal impacts keep template order
        actions.sort(Comparator.comparingDouble(RecommendedAction::impactKg).reversed());
        List<RecommendedAction> ranked = actions.size() > cfg.getMaxActions()
            ? List.copyOf(actions.subList(0, cfg.getMaxActions()))
            : List.copyOf(actions);
        log.debug("Ranked {} actions for sector profile '{}'", ranked.size(), profile.getCode());
        return ranked;
    }

    /**
     * Declared sector when known; otherwise the sector whose typical transport weight
     * is closest to this company's transport share.
     */
    SectorProfile profileFor(CompanyData data, Map<EmissionCategory, Double> breakdown, double breakdownTotal) {
        return sectors.find(data.getSector()).orElseGet(() -> {
            double transport = breakdown.entrySet().stream()
                .filter(e -> e.getKey().isTransport())
                .mapToDouble(Map.Entry::getValue)
                .sum();
            double share = breakdownTotal > 0 ? transport / breakdownTotal : 0;
            SectorProfile nearest = sectors.nearestByTransportWeight(share);
            log.warn("Unknown sector '{}' — recommendations use '{}' (transport share {})",
                data.getSector(), nearest.getCode(), String.format(Locale.ROOT, "%.2f", share));
            return nearest;
        });
    }

    // ── Templates ─────────────────────────────────────────────────────────────

    private void electricity(List<RecommendedAction> out, CompanyData data, double emissions,
                             SectorProfile profile, double total) {
        EngineConfig.Recommendation cfg = config.recommendation();
        double kwh = data.getElectricityKwh();
        if (profile.has(SectorTrait.ENERGY_INTENSIVE)) {
            out.add(action(EmissionCategory.ELECTRICITY, "Energy efficiency upgrade",
                emissions * cfg.getEfficiencyUpgrade(), total,
                "Upgrade lighting and equipment to high-efficiency models",
                String.format(Locale.ROOT, "savings ~€%.0f/yr", kwh * cfg.getEfficiencyUpgrade() * cfg.getElectricityPricePerKwh()),
                "6-12 months"));
        } else {
            out.add(action(EmissionCategory.ELECTRICITY, "Green electricity tariff",
                emissions * cfg.getGreenTariff(), total,
                "Switch to a certified renewable electricity contract",
                String.format(Locale.ROOT, "extra cost ~€%.0f/yr", kwh * cfg.getGreenTariffPremiumPerKwh()),
                "1 month"));
        }
    }

    private void vehicles(List<RecommendedAction> out, CompanyData data, double emissions,
                          SectorProfile profile, double total) {
        EngineConfig.Recommendation cfg = config.recommendation();
        double km = data.getVehicleKm();
        if (profile.has(SectorTrait.FLEET_OPERATOR)) {
            out.add(action(EmissionCategory.VEHICLES, "Route optimisation",
                emissions * cfg.getRouteOptimisation(), total,
                "Plan routes with fleet optimisation software",
                String.format(Locale.ROOT, "fuel savings ~€%.0f/yr",
                    km * cfg.getRouteOptimisation() * cfg.getFleetLitresPerKm() * cfg.getFuelPricePerLitre()),
                "1-3 months"));
            if (km > cfg.getElectrificationMinKm()) {
                out.add(action(EmissionCategory.VEHICLES, "Partial fleet electrification",
                    emissions * cfg.getFleetElectrificationShare() * cfg.getElectricVehicleCut(), total,
                    String.format(Locale.ROOT, "Replace %.0f%% of the fleet with electric vehicles",
                        cfg.getFleetElectrificationShare() * 100),
                    String.format(Locale.ROOT, "investment ~€%.0f",
                        km / cfg.getKmPerVehicle() * cfg.getEvInvestmentPerVehicle()),
                    "12-24 months"));
            }
        } else {
            out.add(action(EmissionCategory.VEHICLES, "Carpooling and telework",
                emissions * cfg.getCarpoolTelework(), total,
                "Introduce a carpooling scheme and two telework days per week",
                "no direct cost",
                "1-2 months"));
        }
    }

    private void fuel(List<RecommendedAction> out, CompanyData data, double emissions,
                      SectorProfile profile, double total) {
        if (!profile.has(SectorTrait.FUEL_INTENSIVE)) return;
        EngineConfig.Recommendation cfg = config.recommendation();
        double litres = data.getFuelLitres();
        out.add(action(EmissionCategory.FUEL, "Eco-driving training",
            emissions * cfg.getEcoDriving(), total,
            "Train drivers in eco-driving techniques",
            String.format(Locale.ROOT, "savings ~€%.0f/yr", litres * cfg.getEcoDriving() * cfg.getFuelPricePerLitre()),
            "1-2 months"));
        if (litres > cfg.getBiofuelMinLitres()) {
            out.add(action(EmissionCategory.FUEL, "Biofuel blend",
                emissions * cfg.getBiofuels(), total,
                "Move part of the fuel supply to certified biofuels",
                String.format(Locale.ROOT, "extra cost ~€%.0f/yr", litres * cfg.getBiofuelPremiumPerLitre()),
                "3-6 months"));
        }
    }

    private void gas(List<RecommendedAction> out, CompanyData data, double emissions,
                     SectorProfile profile, double total) {
        EngineConfig.Recommendation cfg = config.recommendation();
        if (profile.has(SectorTrait.ENERGY_INTENSIVE)) {
            out.add(action(EmissionCategory.GAS, "Heat pump",
                emissions * cfg.getHeatPump(), total,
                "Replace gas boilers with industrial heat pumps",
                String.format(Locale.ROOT, "investment ~€%.0f", data.getGasKwh() * cfg.getHeatPumpCostPerKwh()),
                "12-18 months"));
        } else {
            out.add(action(EmissionCategory.GAS, "Building insulation",
                emissions * cfg.getInsulation(), total,
                "Improve insulation and heating controls",
                "payback 3-5 years",
                "6-12 months"));
        }
    }

    private void flights(List<RecommendedAction> out, EmissionCategory category, double km,
                         double emissions, double total) {
        EngineConfig.Recommendation cfg = config.recommendation();
        out.add(action(category, "Video-conferencing first",
            emissions * cfg.getVideoConferencing(), total,
            "Replace part of " + category.label().toLowerCase(Locale.ROOT) + " with video meetings",
            String.format(Locale.ROOT, "savings ~€%.0f/yr",
                km / 1000 * cfg.getFlightSavingsPerThousandKm() * cfg.getVideoConferencing()),
            "immediate"));
        if (km > cfg.getOffsetMinFlightKm()) {
            // Offsets do not reduce the footprint
            out.add(action(category, "Certified offsetting", 0, total,
                "Offset residual " + category.label().toLowerCase(Locale.ROOT) + " through certified projects",
                String.format(Locale.ROOT, "cost ~€%.0f/yr", emissions * cfg.getOffsetPricePerKg()),
                "immediate"));
        }
    }

    private void purchases(List<RecommendedAction> out, CompanyData data, double emissions,
                           SectorProfile profile, double total) {
        if (profile.has(SectorTrait.FREIGHT_CARRIER)) return;
        EngineConfig.Recommendation cfg = config.recommendation();
        double local = data.getLocalSourcingPct();
        if (local < cfg.getLocalSourcingMaxPct()) {
            double increase = Math.min(cfg.getLocalSourcingMaxStepPct(), cfg.getLocalSourcingCeilingPct() - local);
            out.add(action(EmissionCategory.PURCHASES, "Local sourcing",
                emissions * increase / 100 * cfg.getLocalSourcingCut(), total,
                String.format(Locale.ROOT, "Raise local sourcing by %.0f points", increase),
                "cost neutral",
                "6-12 months"));
        }
        if (data.getPurchaseAmount() > cfg.getSupplierSwitchMinAmount()) {
            out.add(action(EmissionCategory.PURCHASES, "Low-carbon suppliers",
                emissions * cfg.getSupplierSwitch(), total,
                "Select suppliers with verified low-carbon products",
                String.format(Locale.ROOT, "audit cost ~€%.0f", data.getPurchaseAmount() * cfg.getSupplierAuditShare()),
                "6-12 months"));
        }
    }

    private void strategic(List<RecommendedAction> out, CompanyData data, Map<EmissionCategory, Double> breakdown,
                           SectorProfile profile, double total) {
        EngineConfig.Recommendation cfg = config.recommendation();
        switch (profile.getStrategicAction()) {
            case MODAL_SHIFT -> {
                double vehicles = breakdown.getOrDefault(EmissionCategory.VEHICLES, 0.0);
                if (data.getVehicleKm() > cfg.getModalShiftMinKm() && vehicles > 0) {
                    out.add(action(EmissionCategory.VEHICLES, "Modal shift",
                        vehicles * cfg.getModalShift(), total,
                        "Move long-haul freight to rail or waterways",
                        "cost varies by route",
                        "12-24 months"));
                }
            }
            case FOOD_WASTE -> {
                double purchases = breakdown.getOrDefault(EmissionCategory.PURCHASES, 0.0);
                if (purchases > 0) {
                    out.add(action(EmissionCategory.PURCHASES, "Food waste reduction",
                        purchases * cfg.getFoodWaste(), total,
                        "Cut food waste with stock tracking and portion control",
                        String.format(Locale.ROOT, "savings ~€%.0f/yr",
                            data.getPurchaseAmount() * cfg.getFoodWasteSavingsShare()),
                        "3-6 months"));
                }
            }
            case DATA_CENTER -> {
                double electricity = breakdown.getOrDefault(EmissionCategory.ELECTRICITY, 0.0);
                if (data.getElectricityKwh() > cfg.getDataCenterMinKwh()) {
                    out.add(action(EmissionCategory.ELECTRICITY, "Data center optimisation",
                        electricity * cfg.getDataCenter(), total,
                        "Consolidate servers and move workloads to a low-PUE host",
                        "cost neutral over 2 years",
                        "6-12 months"));
                }
            }
            case NONE -> { }
        }
    }

    private static RecommendedAction action(EmissionCategory category, String title, double impactKg,
                                            double breakdownTotal, String description, String cost, String timeline) {
        double share = impactKg / breakdownTotal * 100;
        String text = String.format(Locale.ROOT, "%s: %s. Reduction ~%.0f kgCO2e/yr (%.1f%% of total); %s; timeline %s",
            title, description, impactKg, share, cost, timeline);
        return new RecommendedAction(category, title, impactKg, share, text);
    }
}
