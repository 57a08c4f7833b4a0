package com.jay.carbonscore.model.kpi;

/**
 * Focus areas derived from the breakdown. Category fields hold a category code,
 * or "none" for an empty footprint.
 */
public record Insights(String primaryFocus, String quickWin, String longTermStrategy) {}
