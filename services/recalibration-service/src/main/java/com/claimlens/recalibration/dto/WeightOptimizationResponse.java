package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a weight optimization run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightOptimizationResponse {

    @JsonProperty("optimized_weights")
    private Map<String, Double> optimizedWeights;

    @JsonProperty("improvement_metrics")
    private ImprovementMetrics improvementMetrics;

    private int iterations;
    private boolean converged;

    private String method;
    private String status;

    @JsonProperty("initial_mape")
    private double initialMape;

    @JsonProperty("final_mape")
    private double finalMape;

    @JsonProperty("final_rmse")
    private double finalRmse;

    @JsonProperty("improvement_pct")
    private double improvementPct;

    @JsonProperty("convergence_history")
    private List<ConvergencePoint> convergenceHistory;
}
