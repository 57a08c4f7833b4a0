package com.jay.carbonscore.model.kpi;

public record TrajectoryPoint(int yearOffset, double emissionsKg) {}
