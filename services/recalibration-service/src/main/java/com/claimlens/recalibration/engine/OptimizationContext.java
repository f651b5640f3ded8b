package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Validated inputs of one optimizer run
 */
@Value
@Builder(toBuilder = true)
public class OptimizationContext {

    List<WeightEntry> weightTable;
    OptimizationConfig config;
    PreparedClaims claims;
    ObjectiveFunction objective;
    OptimizationBudget budget;
    WeightVector startingWeights;

    /**
     * Non-frozen factors in weight-table order
     */
    public List<WeightEntry> optimizableFactors() {
        return weightTable.stream()
                .filter(entry -> !config.isFrozen(entry.getFactorName()))
                .collect(Collectors.toList());
    }

    public OptimizationContext withConfig(OptimizationConfig newConfig) {
        return toBuilder().config(newConfig).build();
    }
}
