package com.claimlens.recalibration.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from factor name to weight.
 *
 * <p>Iteration order is the order factors were supplied in, normally the weight-table order, so
 * optimizers that walk factors one at a time stay reproducible. Every update returns a new vector.
 */
@EqualsAndHashCode
public final class WeightVector {

    private final Map<String, Double> weights;

    private WeightVector(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static WeightVector of(Map<String, Double> weights) {
        return new WeightVector(new LinkedHashMap<>(weights));
    }

    public static WeightVector empty() {
        return new WeightVector(new LinkedHashMap<>());
    }

    /**
     * Baseline vector: every factor at its base weight, in table order
     */
    public static WeightVector fromBaseWeights(List<WeightEntry> table) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (WeightEntry entry : table) {
            weights.put(entry.getFactorName(), entry.getBaseWeight());
        }
        return new WeightVector(weights);
    }

    public double get(String factorName) {
        return weights.getOrDefault(factorName, 0.0);
    }

    public boolean contains(String factorName) {
        return weights.containsKey(factorName);
    }

    public WeightVector with(String factorName, double weight) {
        Map<String, Double> copy = new LinkedHashMap<>(weights);
        copy.put(factorName, weight);
        return new WeightVector(copy);
    }

    public Set<String> factorNames() {
        return weights.keySet();
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public int size() {
        return weights.size();
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Override
    public String toString() {
        return "WeightVector" + weights;
    }
}
