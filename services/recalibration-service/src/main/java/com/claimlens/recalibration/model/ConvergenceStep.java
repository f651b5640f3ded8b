package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One recorded optimizer step. The weights are a snapshot, never an alias of later state.
 */
@Value
@Builder
public class ConvergenceStep {

    int iteration;
    double mape;
    double rmse;
    Map<String, Double> weightDeltas;
    WeightVector weights;

    public double maxAbsoluteDelta() {
        return weightDeltas.values().stream()
                .mapToDouble(Math::abs)
                .max()
                .orElse(0.0);
    }
}
