package com.jay.carbonscore.model.kpi;

public record CertificationReadiness(
    boolean iso14001,
    boolean bCorp,
    boolean carbonNeutral,
    boolean scienceBasedTargets
) {}
