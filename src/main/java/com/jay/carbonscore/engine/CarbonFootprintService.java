package com.jay.carbonscore.engine;

import com.jay.carbonscore.config.EngineConfig;
import com.jay.carbonscore.layer1_data.QuestionnaireValidator;
import com.jay.carbonscore.layer2_analysis.BenchmarkAnalyzer;
import com.jay.carbonscore.layer2_analysis.ScopeCalculator;
import com.jay.carbonscore.layer3_kpi.KpiSynthesizer;
import com.jay.carbonscore.layer4_recommendation.RecommendationRanker;
import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.CompanyData;
import com.jay.carbonscore.model.RecommendedAction;
import com.jay.carbonscore.model.TraceEntry;
import com.jay.carbonscore.model.enums.CalculationStage;
import com.jay.carbonscore.model.enums.EmissionCategory;
import com.jay.carbonscore.model.enums.EmployeeBand;
import com.jay.carbonscore.model.kpi.KpiReport;
import com.jay.carbonscore.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Footprint orchestrator.
 * Runs validation → scopes → breakdown → benchmark → recommendations → KPIs → intensities
 * and assembles one immutable {@link CarbonFootprintResult}.
 *
 * Stateless; safe to call concurrently. Any unexpected failure aborts the whole
 * calculation with a {@link CalculationException} naming the stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarbonFootprintService {

    private final EngineConfig config;
    private final QuestionnaireValidator validator;
    private final ScopeCalculator scopeCalculator;
    private final BenchmarkAnalyzer benchmarkAnalyzer;
    private final RecommendationRanker recommendationRanker;
    private final KpiSynthesizer kpiSynthesizer;

    public CarbonFootprintResult calculate(CompanyData data) {
        Objects.requireNonNull(data, "company data");
        String company = data.getCompanyName() != null ? data.getCompanyName() : "<unnamed>";
        log.info("Calculating footprint for '{}' (sector={}, band={})",
            company, data.getSector(), data.getEmployeeBand());

        // ── 1. Validation ─────────────────────────────────────────────────────
        run(CalculationStage.VALIDATION, company, () -> {
            var report = validator.validate(data);
            if (!report.valid()) {
                throw new IllegalArgumentException("Invalid questionnaire: " + String.join("; ", report.errors()));
            }
            return report;
        });

        // ── 2-3. Scopes and breakdown ─────────────────────────────────────────
        ScopeCalculator.ScopeResult scopes = run(CalculationStage.SCOPES, company,
            () -> scopeCalculator.calculate(data));
        Map<EmissionCategory, Double> breakdown = run(CalculationStage.BREAKDOWN, company,
            () -> scopeCalculator.breakdown(data));
        double total = scopes.total();
        double scope1Kg = Rounding.mass(scopes.scope1());
        double scope2Kg = Rounding.mass(scopes.scope2());
        double scope3Kg = Rounding.mass(scopes.scope3());
        // displayed total is the sum of the displayed scopes
        double totalKg = Rounding.sum(scope1Kg, scope2Kg, scope3Kg);

        // ── 4. Benchmark ──────────────────────────────────────────────────────
        EmployeeBand band = EmployeeBand.resolve(data.getEmployeeBand());
        if (!EmployeeBand.isKnown(data.getEmployeeBand())) {
            log.warn("Unknown employee band '{}' — using {} ({} employees)",
                data.getEmployeeBand(), band.code(), band.headcount());
        }
        int employees = band.headcount();
        BenchmarkAnalyzer.BenchmarkResult benchmark = run(CalculationStage.BENCHMARK, company,
            () -> benchmarkAnalyzer.analyse(data.getSector(), total, employees));

        // ── 5. Recommendations ────────────────────────────────────────────────
        List<RecommendedAction> actions = run(CalculationStage.RECOMMENDATIONS, company,
            () -> recommendationRanker.rank(data, breakdown));

        // ── 6. KPIs ───────────────────────────────────────────────────────────
        KpiReport kpis = run(CalculationStage.KPIS, company,
            () -> kpiSynthesizer.synthesize(data, breakdown, total, employees, benchmark.profile()).rounded(totalKg));

        // ── 7. Intensities and assembly ───────────────────────────────────────
        CarbonFootprintResult result = run(CalculationStage.INTENSITY, company, () -> {
            Double perRevenue = data.getRevenue() != null && data.getRevenue() > 0
                ? Rounding.round(total / data.getRevenue() * 1000, 4)
                : null;
            List<RecommendedAction> roundedActions = actions.stream().map(RecommendedAction::rounded).toList();

            return CarbonFootprintResult.builder()
                .companyName(data.getCompanyName())
                .sector(benchmark.profile().getCode())
                .sectorFallback(benchmark.sectorFallback())
                .employeeBand(band.code())
                .employeeCount(employees)
                .totalKg(totalKg)
                .scope1Kg(scope1Kg)
                .scope2Kg(scope2Kg)
                .scope3Kg(scope3Kg)
                .breakdown(byCode(breakdown))
                .unattributedUpstreamKg(Rounding.mass(scopes.upstreamResidual()))
                .recommendations(roundedActions.stream().map(RecommendedAction::text).toList())
                .actions(roundedActions)
                .benchmarkPosition(benchmark.label())
                .benchmarkPercentile(benchmark.percentile())
                .intensityPerEmployeeKg(Rounding.mass(employees > 0 ? total / employees : 0))
                .intensityPerRevenue(perRevenue)
                .kpis(kpis)
                .trace(scopes.trace().stream().map(TraceEntry::rounded).toList())
                .factorSource(config.factorSource())
                .build();
        });

        log.info("Footprint for '{}': {} kgCO2e (scope1={} scope2={} scope3={}), grade {}, {} actions",
            company, result.getTotalKg(), result.getScope1Kg(), result.getScope2Kg(), result.getScope3Kg(),
            kpis.getGrade().label(), actions.size());
        return result;
    }

    private <T> T run(CalculationStage stage, String company, Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            log.error("Calculation for '{}' aborted at {}: {}", company, stage, e.getMessage(), e);
            throw new CalculationException(stage, e);
        }
    }

    private static Map<String, Double> byCode(Map<EmissionCategory, Double> breakdown) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (EmissionCategory category : EmissionCategory.values()) {
            out.put(category.code(), breakdown.getOrDefault(category, 0.0));
        }
        return Rounding.mass(out);
    }
}
