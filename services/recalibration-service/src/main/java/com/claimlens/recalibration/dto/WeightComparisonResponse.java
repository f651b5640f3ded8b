package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Side-by-side metrics of two weight vectors. Differences are {@code a - b}; the vector with
 * the lower MAE is better, ties going to {@code weights_b}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightComparisonResponse {

    public static final String WEIGHTS_A = "weights_a";
    public static final String WEIGHTS_B = "weights_b";

    @JsonProperty("weights_a_metrics")
    private PerformanceMetrics weightsAMetrics;

    @JsonProperty("weights_b_metrics")
    private PerformanceMetrics weightsBMetrics;

    private Comparison comparison;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Comparison {

        @JsonProperty("mae_difference")
        private double maeDifference;

        @JsonProperty("rmse_difference")
        private double rmseDifference;

        @JsonProperty("better_weights")
        private String betterWeights;
    }
}
