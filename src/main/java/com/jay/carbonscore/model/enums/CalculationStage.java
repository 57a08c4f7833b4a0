package com.jay.carbonscore.model.enums;

/** Orchestrator stages, in execution order. */
public enum CalculationStage {
    VALIDATION,
    SCOPES,
    BREAKDOWN,
    BENCHMARK,
    RECOMMENDATIONS,
    KPIS,
    INTENSITY
}
