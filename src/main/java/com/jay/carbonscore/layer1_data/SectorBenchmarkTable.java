package com.jay.carbonscore.layer1_data;

import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.model.SectorProfile;
import com.jay.carbonscore.model.enums.StrategicAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Layer 1 — Sector Benchmark Table.
 * Per-sector reference figures (tCO2e per employee) and recommendation traits.
 * Sectors are matched by code or alias; unknown sectors fall back to the default profile.
 */
@Slf4j
@Component
public class SectorBenchmarkTable {

    public record SectorCatalogEntry(String code, String label) {}

    private final Map<String, SectorProfile> profiles;
    private final Map<String, String> aliases;
    private final SectorProfile defaultProfile;

    public SectorBenchmarkTable(EngineConfig config) {
        Map<String, SectorProfile> byCode = new LinkedHashMap<>();
        Map<String, String> byAlias = new LinkedHashMap<>();

        config.sectors().forEach((rawCode, s) -> {
            String code = normalise(rawCode);
            byCode.put(code, SectorProfile.builder()
                .code(code)
                .label(s.getLabel() != null ? s.getLabel() : code)
                .perEmployeeAverage(s.getPerEmployeeAverage())
                .revenueIntensity(s.getRevenueIntensity())
                .percentile25(s.getPercentile25())
                .percentile75(s.getPercentile75())
                .transportWeight(s.getTransportWeight())
                .traits(s.getTraits() != null ? Set.copyOf(s.getTraits()) : Set.of())
                .strategicAction(s.getStrategicAction() != null ? s.getStrategicAction() : StrategicAction.NONE)
                .build());
            if (s.getAliases() != null) {
                s.getAliases().forEach(a -> byAlias.put(normalise(a), code));
            }
        });
        if (byCode.isEmpty()) {
            throw new IllegalStateException("Sector benchmark table is empty");
        }

        this.profiles = Collections.unmodifiableMap(byCode);
        this.aliases = Collections.unmodifiableMap(byAlias);

        SectorProfile configuredDefault = byCode.get(normalise(config.defaultSector()));
        if (configuredDefault == null) {
            configuredDefault = byCode.values().iterator().next();
            log.warn("Default sector '{}' not in table — falling back to '{}'",
                config.defaultSector(), configuredDefault.getCode());
        }
        this.defaultProfile = configuredDefault;
        log.info("Sector benchmark table ready: {} sectors, default '{}'", profiles.size(), defaultProfile.getCode());
    }

    /** Exact lookup by code or alias (case, spaces and hyphens ignored). */
    public Optional<SectorProfile> find(String sector) {
        if (sector == null || sector.isBlank()) return Optional.empty();
        String key = normalise(sector);
        SectorProfile p = profiles.get(key);
        if (p == null && aliases.containsKey(key)) {
            p = profiles.get(aliases.get(key));
        }
        return Optional.ofNullable(p);
    }

    /** Lookup with fallback to the default profile. Never returns null. */
    public SectorProfile resolve(String sector) {
        return find(sector).orElseGet(() -> {
            log.warn("Unknown sector '{}' — benchmarking against default profile '{}'",
                sector, defaultProfile.getCode());
            return defaultProfile;
        });
    }

    /**
     * Profile whose declared transport weight is closest to the given transport share
     * of a footprint. Ties go to the earlier sector in table order.
     */
    public SectorProfile nearestByTransportWeight(double transportShare) {
        SectorProfile best = defaultProfile;
        double bestDistance = Double.MAX_VALUE;
        for (SectorProfile p : profiles.values()) {
            double d = Math.abs(p.getTransportWeight() - transportShare);
            if (d < bestDistance) {
                best = p;
                bestDistance = d;
            }
        }
        return best;
    }

    public SectorProfile defaultProfile() {
        return defaultProfile;
    }

    public List<SectorCatalogEntry> catalog() {
        return profiles.values().stream()
            .map(p -> new SectorCatalogEntry(p.getCode(), p.getLabel()))
            .toList();
    }

    private static String normalise(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }
}
