package com.jay.carbonscore.layer5_report;

import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.RecommendedAction;
import com.jay.carbonscore.model.kpi.KpiReport;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured summary of a result for downstream text generation.
 * Key order is fixed so the same result always yields the same map.
 */
@Component
public class NarrativeSummaryBuilder {

    private static final int TOP_ACTIONS = 3;

    public Map<String, Object> summarize(CarbonFootprintResult result) {
        KpiReport kpi = result.getKpis();
        Map<String, Object> summary = new LinkedHashMap<>();

        summary.put("company", result.getCompanyName());
        summary.put("sector", result.getSector());
        summary.put("employees", result.getEmployeeCount());
        summary.put("total_kg", result.getTotalKg());
        summary.put("scopes", ordered(
            "scope1_kg", result.getScope1Kg(),
            "scope2_kg", result.getScope2Kg(),
            "scope3_kg", result.getScope3Kg()));
        summary.put("benchmark", result.getBenchmarkPosition());
        summary.put("efficiency_score", kpi.getEfficiencyScore());
        summary.put("grade", kpi.getGrade().label());
        summary.put("primary_focus", kpi.getInsights().primaryFocus());
        summary.put("quick_win", kpi.getInsights().quickWin());
        summary.put("long_term_strategy", kpi.getInsights().longTermStrategy());
        summary.put("cost_of_carbon_eur", kpi.getCostOfCarbon());
        summary.put("target_year", kpi.getTrajectory().targetYear());
        summary.put("target_kg", kpi.getTrajectory().targetKg());

        List<RecommendedAction> actions = result.getActions();
        summary.put("top_actions", actions.stream()
            .limit(TOP_ACTIONS)
            .map(a -> ordered("action", a.action(), "category", a.category().code(), "impact_kg", a.impactKg()))
            .toList());
        return Collections.unmodifiableMap(summary);
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
