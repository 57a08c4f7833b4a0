package com.jay.carbonscore.layer5_report;

import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.kpi.CertificationReadiness;
import com.jay.carbonscore.model.kpi.KpiReport;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Layer 5 — Carbon Report Generator.
 * Fixed-layout plain-text report of a finished calculation.
 * Reads the result only; never recomputes anything.
 */
@Component
public class CarbonReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    public String generate(CarbonFootprintResult result) {
        KpiReport kpi = result.getKpis();
        StringBuilder sb = new StringBuilder();

        sb.append("🌍 CARBON FOOTPRINT REPORT  —  ")
            .append(result.getCompanyName() != null ? result.getCompanyName() : "Unnamed company").append("\n");
        sb.append(DIVIDER).append("\n");
        sb.append(line("SECTOR            :  %s%s", result.getSector(),
            result.isSectorFallback() ? "  (declared sector unknown)" : ""));
        sb.append(line("EMPLOYEES         :  %s  (~%d)", result.getEmployeeBand(), result.getEmployeeCount()));
        sb.append(line("FACTOR SOURCE     :  %s", result.getFactorSource()));
        sb.append(DIVIDER).append("\n");
        sb.append(line("TOTAL             :  %,.2f kgCO2e/yr", result.getTotalKg()));
        sb.append(line("SCOPE 1 (direct)  :  %,.2f kgCO2e", result.getScope1Kg()));
        sb.append(line("SCOPE 2 (energy)  :  %,.2f kgCO2e", result.getScope2Kg()));
        sb.append(line("SCOPE 3 (indirect):  %,.2f kgCO2e", result.getScope3Kg()));
        sb.append(DIVIDER).append("\n");

        sb.append("BREAKDOWN:\n");
        for (Map.Entry<String, Double> e : result.getBreakdown().entrySet()) {
            sb.append(line("   • %-22s %,12.2f kgCO2e", e.getKey(), e.getValue()));
        }
        sb.append(line("   • %-22s %,12.2f kgCO2e", "upstream (unassigned)", result.getUnattributedUpstreamKg()));
        sb.append(DIVIDER).append("\n");

        sb.append(line("BENCHMARK         :  %s  (percentile %d)",
            result.getBenchmarkPosition(), result.getBenchmarkPercentile()));
        sb.append(line("PER EMPLOYEE      :  %,.2f kgCO2e", result.getIntensityPerEmployeeKg()));
        if (result.getIntensityPerRevenue() != null) {
            sb.append(line("PER k€ REVENUE    :  %.4f kgCO2e", result.getIntensityPerRevenue()));
        }
        sb.append(DIVIDER).append("\n");

        sb.append(line("EFFICIENCY SCORE  :  %.1f / 100  [%s]", kpi.getEfficiencyScore(), kpi.getGrade().label()));
        sb.append(line("COST OF CARBON    :  €%,.2f", kpi.getCostOfCarbon()));
        sb.append(line("2030 TARGET       :  %,.2f kgCO2e  (feasible with actions: %,.2f)",
            kpi.getTrajectory().targetKg(), kpi.getTrajectory().feasibleWithActionsKg()));
        sb.append(line("EQUIVALENT TO     :  %.1f trees, %.1f cars off the road",
            kpi.getEquivalents().treesToPlant(), kpi.getEquivalents().carsOffRoad()));
        sb.append(DIVIDER).append("\n");

        CertificationReadiness c = kpi.getCertifications();
        sb.append("CERTIFICATIONS:\n");
        sb.append(line("   %s ISO 14001", mark(c.iso14001())));
        sb.append(line("   %s B Corp", mark(c.bCorp())));
        sb.append(line("   %s Carbon neutral", mark(c.carbonNeutral())));
        sb.append(line("   %s Science-based targets", mark(c.scienceBasedTargets())));
        sb.append(DIVIDER).append("\n");

        if (result.getRecommendations().isEmpty()) {
            sb.append("No priority actions identified.\n");
        } else {
            sb.append("PRIORITY ACTIONS:\n");
            int i = 1;
            for (String r : result.getRecommendations()) {
                sb.append(line("   %d. %s", i++, r));
            }
        }
        sb.append("─────────────────────────────────────────────────────────\n");
        return sb.toString();
    }

    private static String line(String format, Object... args) {
        return String.format(Locale.ROOT, format, args) + "\n";
    }

    private static String mark(boolean ready) {
        return ready ? "✅" : "⬜";
    }
}
