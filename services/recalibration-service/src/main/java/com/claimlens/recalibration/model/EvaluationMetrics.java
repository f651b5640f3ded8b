package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregate error statistics of a prediction set against actual settlements
 */
@Value
@Builder
public class EvaluationMetrics {

    int claimCount;

    /** Claims with a non-zero actual settlement, the basis of every percentage aggregate */
    int percentageClaimCount;

    double mae;
    double mape;
    double rmse;
    double rSquared;
    double totalVariance;
    double avgVariance;

    /** Per-claim variance %, in claim order; {@code null} where the actual settlement is zero */
    List<Double> variancePcts;
}
