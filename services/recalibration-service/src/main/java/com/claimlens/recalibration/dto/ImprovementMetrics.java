package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relative improvement of optimized over current weights, in percent. A metric whose current
 * value is 0 reports 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImprovementMetrics {

    @JsonProperty("mae_improvement")
    private double maeImprovement;

    @JsonProperty("rmse_improvement")
    private double rmseImprovement;

    @JsonProperty("variance_reduction")
    private double varianceReduction;

    public static ImprovementMetrics between(PerformanceMetrics current, PerformanceMetrics optimized) {
        return ImprovementMetrics.builder()
                .maeImprovement(relativeReduction(current.getMae(), optimized.getMae()))
                .rmseImprovement(relativeReduction(current.getRmse(), optimized.getRmse()))
                .varianceReduction(relativeReduction(Math.abs(current.getAvgVariance()),
                        Math.abs(optimized.getAvgVariance())))
                .build();
    }

    private static double relativeReduction(double before, double after) {
        if (before == 0.0) {
            return 0.0;
        }
        return (before - after) / before * 100.0;
    }
}
