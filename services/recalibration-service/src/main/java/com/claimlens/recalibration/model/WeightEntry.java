package com.claimlens.recalibration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the factor weight table.
 *
 * <p>Mutable so it can be bound from configuration; the engine never modifies entries it is given.
 * Invariant {@code minWeight <= baseWeight <= maxWeight} is enforced by {@code WeightTableValidator}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WeightEntry {

    private String factorName;
    private double baseWeight;
    private double minWeight;
    private double maxWeight;
    private String category;
    private String description;

    public static WeightEntry of(String factorName, double baseWeight, double minWeight, double maxWeight) {
        return WeightEntry.builder()
                .factorName(factorName)
                .baseWeight(baseWeight)
                .minWeight(minWeight)
                .maxWeight(maxWeight)
                .build();
    }

    public double range() {
        return maxWeight - minWeight;
    }

    public double clamp(double weight) {
        return Math.max(minWeight, Math.min(maxWeight, weight));
    }

    public boolean contains(double weight) {
        return weight >= minWeight && weight <= maxWeight;
    }
}
