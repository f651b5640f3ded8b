package com.claimlens.recalibration.dto;

import com.claimlens.recalibration.model.WeightRecommendation;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Suggested weight vector (rescaled to the base-weight total) with per-factor explanations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightRecommendationResponse {

    @JsonProperty("recommended_weights")
    private Map<String, Double> recommendedWeights;

    private List<WeightRecommendation> recommendations;

    @JsonProperty("claims_analyzed")
    private int claimsAnalyzed;

    @JsonProperty("recent_months")
    private Integer recentMonths;
}
