package com.jay.carbonscore.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.carbonscore.model.enums.SectorTrait;
import com.jay.carbonscore.model.enums.StrategicAction;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes the engine configuration from carbon-engine.yaml:
 * emission factors, sector benchmarks, KPI constants and recommendation multipliers.
 * Values are read once at startup; the tables built from them are read-only.
 */
@Slf4j
@Component
public class EngineConfig {

    public static final String DEFAULT_FILE = "carbon-engine.yaml";

    @Value("${carbon.config-file:" + DEFAULT_FILE + "}")
    private String configFile = DEFAULT_FILE;

    // ── Sections ──────────────────────────────────────────────────────────────
    private String factorSource = "ADEME Base Carbone v17";
    private Map<String, Double> factors = defaultFactors();
    private String defaultSector = "services";
    private Map<String, Sector> sectors = defaultSectors();
    private Kpi kpi = new Kpi();
    private Recommendation recommendation = new Recommendation();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root.getFactorSource() != null)  this.factorSource = root.getFactorSource();
            if (root.getFactors() != null)       this.factors = root.getFactors();
            if (root.getDefaultSector() != null) this.defaultSector = root.getDefaultSector();
            if (root.getSectors() != null && !root.getSectors().isEmpty()) this.sectors = root.getSectors();
            if (root.getKpi() != null)            this.kpi = root.getKpi();
            if (root.getRecommendation() != null) this.recommendation = root.getRecommendation();

            kpi.setSeasonalWeights(normaliseSeasonalWeights(kpi.getSeasonalWeights()));
            log.info("EngineConfig loaded from '{}': {} factors, {} sectors (default '{}')",
                configFile, factors.size(), sectors.size(), defaultSector);
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    /**
     * Scales the monthly weights so they sum to 12. Falls back to the defaults
     * when the vector is not 12 finite, non-negative values with a positive sum.
     */
    static List<Double> normaliseSeasonalWeights(List<Double> weights) {
        if (weights == null || weights.size() != 12
                || weights.stream().anyMatch(w -> w == null || !Double.isFinite(w) || w < 0)) {
            log.warn("kpi.seasonal_weights must be 12 non-negative numbers — using defaults");
            return Kpi.DEFAULT_SEASONAL_WEIGHTS;
        }
        double sum = weights.stream().mapToDouble(Double::doubleValue).sum();
        if (sum <= 0) {
            log.warn("kpi.seasonal_weights sum to zero — using defaults");
            return Kpi.DEFAULT_SEASONAL_WEIGHTS;
        }
        return weights.stream().map(w -> w * 12 / sum).toList();
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public String factorSource()                { return factorSource; }
    public Map<String, Double> factors()        { return factors; }
    public String defaultSector()               { return defaultSector; }
    public Map<String, Sector> sectors()        { return sectors; }
    public Kpi kpi()                            { return kpi; }
    public Recommendation recommendation()      { return recommendation; }

    // ── Defaults ──────────────────────────────────────────────────────────────

    private static Map<String, Double> defaultFactors() {
        return Map.ofEntries(
            Map.entry("electricity_grid", 0.0571),
            Map.entry("natural_gas", 0.227),
            Map.entry("petrol", 2.80),
            Map.entry("diesel", 3.10),
            Map.entry("car_petrol", 0.193),
            Map.entry("car_diesel", 0.166),
            Map.entry("flight_domestic", 0.230),
            Map.entry("flight_international", 0.156),
            Map.entry("purchased_goods", 0.45),
            Map.entry("purchased_services", 0.32),
            Map.entry("local_sourcing_reduction", 0.20),
            Map.entry("upstream_electricity", 0.0134),
            Map.entry("upstream_gas", 0.0456)
        );
    }

    // Only the fallback profile; the full table lives in carbon-engine.yaml
    private static Map<String, Sector> defaultSectors() {
        Sector services = new Sector();
        services.setLabel("Business services");
        services.setPerEmployeeAverage(4.2);
        services.setRevenueIntensity(0.0028);
        services.setPercentile25(2.8);
        services.setPercentile75(6.9);
        services.setTransportWeight(0.25);
        Map<String, Sector> map = new LinkedHashMap<>();
        map.put("services", services);
        return map;
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private String factorSource;
        private Map<String, Double> factors;
        private String defaultSector;
        private LinkedHashMap<String, Sector> sectors;
        private Kpi kpi;
        private Recommendation recommendation;
    }

    @Data public static class Sector {
        private String label;
        private double perEmployeeAverage;   // tCO2e / employee
        private double revenueIntensity;
        private double percentile25;
        private double percentile75;
        private double transportWeight;
        private List<SectorTrait> traits = List.of();
        private StrategicAction strategicAction = StrategicAction.NONE;
        private List<String> aliases = List.of();
    }

    @Data public static class Kpi {
        static final List<Double> DEFAULT_SEASONAL_WEIGHTS =
            List.of(1.3, 1.2, 1.1, 1.0, 0.9, 0.8, 0.7, 0.7, 0.9, 1.0, 1.1, 1.3);

        private double efficiencyBaseline = 50;

        // Achievable abatement per category
        private double electricityReduction = 0.30;
        private double vehiclesReduction = 0.50;
        private double flightsReduction = 0.25;
        private double purchasesReduction = 0.20;
        private double otherReduction = 0.15;

        // Trajectory
        private int targetYear = 2030;
        private double targetCut = 0.55;
        private double annualPace = 0.055;
        private int horizonYears = 10;

        private double carbonPricePerTonne = 100;

        // Equivalents, per tCO2e
        private double treesPerTonne = 40;
        private double carTonnesPerYear = 4.6;
        private double homeTonnesPerYear = 6.8;
        private double parisNewYorkFlightTonnes = 1.8;

        private List<Double> seasonalWeights = DEFAULT_SEASONAL_WEIGHTS;

        // Certification thresholds
        private double isoMinScore = 70;
        private double bcorpMinScore = 80;
        private double bcorpMinLocalPct = 50;
        private double carbonNeutralCoverage = 0.80;

        private double electrificationVehicleShare = 0.20;
    }

    @Data public static class Recommendation {
        private int maxActions = 8;
        private int topCategories = 5;
        private double minSharePct = 5;

        // Per-template reduction multipliers (share of the category's emissions)
        private double efficiencyUpgrade = 0.30;
        private double greenTariff = 0.65;
        private double routeOptimisation = 0.12;
        private double fleetElectrificationShare = 0.30;
        private double electricVehicleCut = 0.65;
        private double carpoolTelework = 0.25;
        private double ecoDriving = 0.15;
        private double biofuels = 0.20;
        private double heatPump = 0.60;
        private double insulation = 0.25;
        private double videoConferencing = 0.30;
        private double localSourcingCut = 0.20;
        private double supplierSwitch = 0.17;
        private double modalShift = 0.25;
        private double foodWaste = 0.15;
        private double dataCenter = 0.25;

        // Raw-quantity gates
        private double electrificationMinKm = 20_000;
        private double biofuelMinLitres = 5_000;
        private double offsetMinFlightKm = 10_000;
        private double supplierSwitchMinAmount = 100_000;
        private double modalShiftMinKm = 50_000;
        private double dataCenterMinKwh = 30_000;
        private double localSourcingMaxPct = 60;
        private double localSourcingCeilingPct = 70;
        private double localSourcingMaxStepPct = 30;

        // Linear cost estimates
        private double electricityPricePerKwh = 0.15;
        private double greenTariffPremiumPerKwh = 0.02;
        private double fuelPricePerLitre = 1.8;
        private double fleetLitresPerKm = 0.06;
        private double evInvestmentPerVehicle = 35_000;
        private double kmPerVehicle = 20_000;
        private double biofuelPremiumPerLitre = 0.10;
        private double heatPumpCostPerKwh = 0.08;
        private double flightSavingsPerThousandKm = 0.15;
        private double offsetPricePerKg = 0.025;
        private double supplierAuditShare = 0.001;
        private double foodWasteSavingsShare = 0.08;
    }
}
