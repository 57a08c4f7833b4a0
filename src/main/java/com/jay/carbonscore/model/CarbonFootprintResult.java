package com.jay.carbonscore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.carbonscore.model.kpi.KpiReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Full footprint result for one questionnaire.
 * Returned by CarbonFootprintService; immutable, and never partially populated.
 * Mass figures are kgCO2e per year.
 */
@Value
@Builder
public class CarbonFootprintResult {

    private String companyName;

    // ── Resolved inputs ───────────────────────────────────────────────────────
    private String  sector;            // profile actually used for benchmarks
    private boolean sectorFallback;    // true when the declared sector was unknown
    private String  employeeBand;
    private int     employeeCount;

    // ── Scopes ────────────────────────────────────────────────────────────────
    private double totalKg;
    private double scope1Kg;
    private double scope2Kg;
    private double scope3Kg;

    // ── Breakdown ─────────────────────────────────────────────────────────────
    private Map<String, Double> breakdown;   // category code -> kgCO2e, fixed key order
    private double unattributedUpstreamKg;   // in scope 3, in no breakdown category

    // ── Actions ───────────────────────────────────────────────────────────────
    private List<String>            recommendations;
    private List<RecommendedAction> actions;

    // ── Benchmark & intensities ───────────────────────────────────────────────
    private String benchmarkPosition;
    private int    benchmarkPercentile;
    private double intensityPerEmployeeKg;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double intensityPerRevenue;      // kgCO2e per k€, null when revenue unknown

    // ── KPIs & provenance ─────────────────────────────────────────────────────
    private KpiReport        kpis;
    private List<TraceEntry> trace;
    private String           factorSource;
}
