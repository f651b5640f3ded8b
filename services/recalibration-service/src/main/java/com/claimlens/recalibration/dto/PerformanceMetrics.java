package com.claimlens.recalibration.dto;

import com.claimlens.recalibration.model.EvaluationMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate error metrics of one weight vector over a claim set
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private double mae;
    private double rmse;
    private double mape;

    @JsonProperty("r_squared")
    private double coefficientOfDetermination;

    @JsonProperty("total_variance")
    private double totalVariance;

    @JsonProperty("avg_variance")
    private double avgVariance;

    public static PerformanceMetrics from(EvaluationMetrics metrics) {
        return PerformanceMetrics.builder()
                .mae(metrics.getMae())
                .rmse(metrics.getRmse())
                .mape(metrics.getMape())
                .coefficientOfDetermination(metrics.getRSquared())
                .totalVariance(metrics.getTotalVariance())
                .avgVariance(metrics.getAvgVariance())
                .build();
    }
}
