package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one optimizer invocation
 */
@Value
@Builder(toBuilder = true)
public class OptimizationResult {

    OptimizationMethod method;
    OptimizationStatus status;
    WeightVector optimizedWeights;
    int iterationsRun;
    double initialMape;
    double initialRmse;
    double finalMape;
    double finalRmse;
    double improvementPct;
    boolean converged;

    @Singular("step")
    List<ConvergenceStep> convergenceHistory;
}
