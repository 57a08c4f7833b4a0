package com.jay.carbonscore.layer3_kpi;

import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.layer2_analysis.BenchmarkAnalyzer;
import com.jay.carbonscore.model.CompanyData;
import com.jay.carbonscore.model.SectorProfile;
import com.jay.carbonscore.model.enums.BenchmarkPosition;
import com.jay.carbonscore.model.enums.EmissionCategory;
import com.jay.carbonscore.model.enums.SustainabilityGrade;
import com.jay.carbonscore.model.kpi.CertificationReadiness;
import com.jay.carbonscore.model.kpi.EquivalentMetrics;
import com.jay.carbonscore.model.kpi.Insights;
import com.jay.carbonscore.model.kpi.KpiReport;
import com.jay.carbonscore.model.kpi.MonthlyEmission;
import com.jay.carbonscore.model.kpi.PeerComparison;
import com.jay.carbonscore.model.kpi.Trajectory;
import com.jay.carbonscore.model.kpi.TrajectoryPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 3 — KPI Synthesizer.
 * Derives the KPI block from an already computed footprint. Never recomputes scopes.
 * Values are full precision; rounding happens in {@link KpiReport#rounded(double)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KpiSynthesizer {

    static final String ELECTRIFICATION = "electrification";
    static final String ENERGY_EFFICIENCY = "energy_efficiency";
    static final String NONE = "none";

    private final EngineConfig config;

    public KpiReport synthesize(CompanyData data,
                                Map<EmissionCategory, Double> breakdown,
                                double totalKg,
                                int employeeCount,
                                SectorProfile profile) {
        EngineConfig.Kpi cfg = config.kpi();

        double score = efficiencyScore(totalKg, employeeCount, profile);
        Map<EmissionCategory, Double> potential = reductionPotential(breakdown);
        double feasible = potential.values().stream().mapToDouble(Double::doubleValue).sum();
        Trajectory trajectory = trajectory(totalKg, feasible);
        double tonnes = totalKg / 1000.0;

        // ── Certification readiness ───────────────────────────────────────────
        CertificationReadiness certifications = new CertificationReadiness(
            score >= cfg.getIsoMinScore(),
            score >= cfg.getBcorpMinScore() && data.getLocalSourcingPct() >= cfg.getBcorpMinLocalPct(),
            feasible >= cfg.getCarbonNeutralCoverage() * totalKg,
            feasible >= trajectory.targetKg());

        KpiReport report = KpiReport.builder()
            .efficiencyScore(score)
            .grade(SustainabilityGrade.fromScore(score))
            .reductionPotential(byCode(potential))
            .trajectory(trajectory)
            .costOfCarbon(tonnes * cfg.getCarbonPricePerTonne())
            .equivalents(new EquivalentMetrics(
                tonnes * cfg.getTreesPerTonne(),
                tonnes / cfg.getCarTonnesPerYear(),
                tonnes / cfg.getHomeTonnesPerYear(),
                tonnes / cfg.getParisNewYorkFlightTonnes()))
            .monthly(monthly(totalKg))
            .peerComparison(peerComparison(totalKg, employeeCount, profile))
            .certifications(certifications)
            .insights(insights(breakdown, potential, totalKg))
            .build();

        log.debug("KPIs: score={} grade={} feasible={}kg target={}kg",
            score, report.getGrade().label(), feasible, trajectory.targetKg());
        return report;
    }

    // ── Efficiency score ──────────────────────────────────────────────────────

    /** Sector average over company intensity, scaled so parity scores the baseline (50). */
    double efficiencyScore(double totalKg, int employeeCount, SectorProfile profile) {
        if (employeeCount <= 0) return 0;
        double perEmployee = totalKg / 1000.0 / employeeCount;
        if (perEmployee <= 0) return 100;
        double raw = profile.getPerEmployeeAverage() / perEmployee * config.kpi().getEfficiencyBaseline();
        return Math.max(0, Math.min(100, raw));
    }

    // ── Reduction potential ───────────────────────────────────────────────────

    Map<EmissionCategory, Double> reductionPotential(Map<EmissionCategory, Double> breakdown) {
        Map<EmissionCategory, Double> out = new LinkedHashMap<>();
        for (EmissionCategory category : EmissionCategory.values()) {
            double emissions = breakdown.getOrDefault(category, 0.0);
            out.put(category, emissions * reductionRate(category));
        }
        return out;
    }

    private double reductionRate(EmissionCategory category) {
        EngineConfig.Kpi cfg = config.kpi();
        return switch (category) {
            case ELECTRICITY -> cfg.getElectricityReduction();
            case VEHICLES -> cfg.getVehiclesReduction();
            case DOMESTIC_FLIGHTS, INTERNATIONAL_FLIGHTS -> cfg.getFlightsReduction();
            case PURCHASES -> cfg.getPurchasesReduction();
            case GAS, FUEL -> cfg.getOtherReduction();
        };
    }

    // ── Trajectory ────────────────────────────────────────────────────────────

    Trajectory trajectory(double totalKg, double feasibleKg) {
        EngineConfig.Kpi cfg = config.kpi();
        double target = totalKg * (1 - cfg.getTargetCut());
        double pace = totalKg * cfg.getAnnualPace();

        List<TrajectoryPoint> path = new ArrayList<>();
        for (int year = 1; year <= cfg.getHorizonYears(); year++) {
            path.add(new TrajectoryPoint(year, Math.max(target, totalKg - year * pace)));
        }
        return new Trajectory(cfg.getTargetYear(), totalKg, target, pace, feasibleKg,
            Collections.unmodifiableList(path));
    }

    // ── Monthly distribution ──────────────────────────────────────────────────

    /** Twelve months weighted by season; December takes the remainder so the months sum to the total. */
    List<MonthlyEmission> monthly(double totalKg) {
        List<Double> weights = config.kpi().getSeasonalWeights();
        List<MonthlyEmission> months = new ArrayList<>(12);
        double allocated = 0;
        for (int m = 1; m <= 11; m++) {
            double value = totalKg / 12 * weights.get(m - 1);
            allocated += value;
            months.add(new MonthlyEmission(m, value, weights.get(m - 1)));
        }
        months.add(new MonthlyEmission(12, totalKg - allocated, weights.get(11)));
        return Collections.unmodifiableList(months);
    }

    // ── Peer comparison ───────────────────────────────────────────────────────

    PeerComparison peerComparison(double totalKg, int employeeCount, SectorProfile profile) {
        if (employeeCount <= 0) {
            return new PeerComparison(BenchmarkPosition.INSUFFICIENT_DATA.percentile(), 0, 0, 0);
        }
        BenchmarkPosition position = BenchmarkAnalyzer.position(totalKg / 1000.0 / employeeCount, profile);
        double sectorAverage = profile.getPerEmployeeAverage() * 1000 * employeeCount;
        double bestInClass = profile.getPercentile25() * 1000 * employeeCount;
        return new PeerComparison(position.percentile(), sectorAverage, bestInClass,
            Math.max(0, totalKg - bestInClass));
    }

    // ── Insights ──────────────────────────────────────────────────────────────

    Insights insights(Map<EmissionCategory, Double> breakdown,
                      Map<EmissionCategory, Double> potential,
                      double totalKg) {
        String strategy = breakdown.getOrDefault(EmissionCategory.VEHICLES, 0.0)
            > config.kpi().getElectrificationVehicleShare() * totalKg
            ? ELECTRIFICATION : ENERGY_EFFICIENCY;
        return new Insights(largest(breakdown), largest(potential), strategy);
    }

    // Ties resolve to the earlier category; an all-zero map has no focus
    private static String largest(Map<EmissionCategory, Double> values) {
        EmissionCategory best = null;
        double max = 0;
        for (EmissionCategory category : EmissionCategory.values()) {
            double v = values.getOrDefault(category, 0.0);
            if (v > max) {
                best = category;
                max = v;
            }
        }
        return best != null ? best.code() : NONE;
    }

    private static Map<String, Double> byCode(Map<EmissionCategory, Double> values) {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.code(), v));
        return Collections.unmodifiableMap(out);
    }
}
