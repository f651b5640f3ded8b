package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of one settled insurance claim.
 *
 * <p>Feature values arrive exactly as the data layer stored them: numbers, numeric strings or
 * categorical text, any of which may be missing. They are never read directly; scoring code goes
 * through {@code FeatureValues}.
 */
@Value
@Builder(toBuilder = true)
public class ClaimRecord {

    String claimId;
    Integer version;
    LocalDate claimDate;

    /** Actual settlement amount */
    double actualSettlement;

    /** Prediction recorded alongside the claim, when the data layer has one */
    Double predictedSettlement;

    @Singular
    Map<String, Object> features;

    public Object feature(String name) {
        return features.get(name);
    }

    /**
     * Whether percentage-based error metrics can be computed for this claim
     */
    public boolean hasPercentageBasis() {
        return actualSettlement != 0.0;
    }

    /**
     * Variance % of the recorded prediction: (predicted - actual) / actual * 100.
     * Empty when there is no recorded prediction or the actual settlement is zero.
     */
    public OptionalDouble recordedVariancePct() {
        if (predictedSettlement == null || !hasPercentageBasis()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((predictedSettlement - actualSettlement) / actualSettlement * 100.0);
    }
}
