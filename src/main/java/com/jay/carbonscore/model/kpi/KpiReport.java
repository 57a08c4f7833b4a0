package com.jay.carbonscore.model.kpi;

import com.jay.carbonscore.model.enums.SustainabilityGrade;
import com.jay.carbonscore.util.Rounding;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

@Value
@Builder(toBuilder = true)
public class KpiReport {

    private double efficiencyScore;                 // 0 - 100
    private SustainabilityGrade grade;
    private Map<String, Double> reductionPotential; // category code -> kgCO2e
    private Trajectory trajectory;
    private double costOfCarbon;                    // €
    private EquivalentMetrics equivalents;
    private List<MonthlyEmission> monthly;
    private PeerComparison peerComparison;
    private CertificationReadiness certifications;
    private Insights insights;

    /**
     * Copy with output precision applied. The grade follows the displayed score and the
     * monthly split adds up to {@code roundedTotalKg} to the cent.
     */
    public KpiReport rounded(double roundedTotalKg) {
        double score = Rounding.score(efficiencyScore);
        List<Double> monthlyKg = Rounding.massParts(monthly.stream().map(MonthlyEmission::emissionsKg).toList(),
            roundedTotalKg);
        return toBuilder()
            .efficiencyScore(score)
            .grade(SustainabilityGrade.fromScore(score))
            .reductionPotential(Rounding.mass(reductionPotential))
            .trajectory(trajectory.rounded(roundedTotalKg))
            .costOfCarbon(Rounding.mass(costOfCarbon))
            .equivalents(equivalents.rounded())
            .monthly(IntStream.range(0, monthly.size())
                .mapToObj(i -> monthly.get(i).rounded(monthlyKg.get(i)))
                .toList())
            .peerComparison(peerComparison.rounded())
            .build();
    }
}
