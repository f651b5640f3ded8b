package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Parameters of one optimizer run. Validated by {@code WeightTableValidator} before use.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationConfig {

    @Builder.Default
    TargetMetric targetMetric = TargetMetric.MAPE;

    @Builder.Default
    int maxIterations = 100;

    /** Step size as a fraction of each factor's weight range, in (0, 1] */
    @Builder.Default
    double learningRate = 0.05;

    @Builder.Default
    double convergenceThreshold = 0.001;

    @Builder.Default
    Set<String> frozenFactors = Set.of();

    /** Grid search intervals per factor; 0 samples only the minimum weight */
    @Builder.Default
    int gridSteps = 5;

    /** Number of factors the correlation-guided strategy keeps free */
    @Builder.Default
    int topFactorCount = 10;

    public boolean isFrozen(String factorName) {
        return frozenFactors.contains(factorName);
    }
}
