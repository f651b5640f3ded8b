package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

/**
 * Explained suggestion to move one factor's weight
 */
@Value
@Builder
public class WeightRecommendation {

    public enum Confidence { HIGH, MEDIUM, LOW }

    String factorName;
    double currentWeight;
    double suggestedWeight;
    double correlation;
    double normalizedImpact;
    String reason;
    int expectedImprovement;
    Confidence confidence;
}
