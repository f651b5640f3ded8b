package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Fail-fast checks run before any scoring or search starts
 */
@Component
public class WeightTableValidator {

    public void validateClaims(List<ClaimRecord> claims) {
        if (claims == null || claims.isEmpty()) {
            throw new InsufficientDataException("No claims data available");
        }
    }

    public void validateTable(List<WeightEntry> table) {
        if (table == null || table.isEmpty()) {
            throw new InputValidationException("Weight table must contain at least one factor");
        }
        Set<String> seen = new HashSet<>();
        for (WeightEntry entry : table) {
            String name = entry.getFactorName();
            if (name == null || name.isBlank()) {
                throw new InputValidationException("Weight table entry without a factor name");
            }
            if (!seen.add(name)) {
                throw new InputValidationException("Duplicate factor in weight table: " + name);
            }
            if (!Double.isFinite(entry.getMinWeight()) || !Double.isFinite(entry.getMaxWeight())
                    || !Double.isFinite(entry.getBaseWeight())) {
                throw new InputValidationException("Non-finite weight bound for factor " + name);
            }
            if (entry.getMinWeight() > entry.getMaxWeight()) {
                throw new InputValidationException(String.format(
                        "Factor %s has min_weight %s greater than max_weight %s",
                        name, entry.getMinWeight(), entry.getMaxWeight()));
            }
            if (!entry.contains(entry.getBaseWeight())) {
                throw new InputValidationException(String.format(
                        "Factor %s has base_weight %s outside [%s, %s]",
                        name, entry.getBaseWeight(), entry.getMinWeight(), entry.getMaxWeight()));
            }
        }
    }

    public void validateConfig(OptimizationConfig config, List<WeightEntry> table) {
        if (config == null || config.getTargetMetric() == null) {
            throw new InputValidationException("Optimization config requires a target metric");
        }
        if (config.getMaxIterations() < 0) {
            throw new InputValidationException("max_iterations must not be negative: " + config.getMaxIterations());
        }
        double learningRate = config.getLearningRate();
        if (!(learningRate > 0.0 && learningRate <= 1.0)) {
            throw new InputValidationException("learning_rate must be in (0, 1]: " + learningRate);
        }
        if (!(config.getConvergenceThreshold() >= 0.0) || Double.isInfinite(config.getConvergenceThreshold())) {
            throw new InputValidationException("convergence_threshold must be a non-negative number: "
                    + config.getConvergenceThreshold());
        }
        if (config.getGridSteps() < 0) {
            throw new InputValidationException("grid_steps must not be negative: " + config.getGridSteps());
        }
        if (config.getTopFactorCount() < 1) {
            throw new InputValidationException("top_factor_count must be at least 1: " + config.getTopFactorCount());
        }

        if (config.getFrozenFactors() == null) {
            throw new InputValidationException("frozen_factors must not be null");
        }
        Set<String> factorNames = table.stream().map(WeightEntry::getFactorName).collect(Collectors.toSet());
        Set<String> unknown = config.getFrozenFactors().stream()
                .filter(factor -> !factorNames.contains(factor))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!unknown.isEmpty()) {
            throw new InputValidationException("Frozen factors not present in weight table: " + unknown);
        }
    }

    /**
     * Every weight must be finite; factors known to the table must sit inside their bounds
     */
    public void validateVector(WeightVector weights, List<WeightEntry> table) {
        if (weights == null) {
            throw new InputValidationException("Weight vector is required");
        }
        weights.asMap().forEach((factor, weight) -> {
            if (weight == null || !Double.isFinite(weight)) {
                throw new InputValidationException("Non-finite weight for factor " + factor);
            }
        });
        for (WeightEntry entry : table) {
            if (weights.contains(entry.getFactorName()) && !entry.contains(weights.get(entry.getFactorName()))) {
                throw new InputValidationException(String.format(
                        "Weight %s for factor %s outside [%s, %s]", weights.get(entry.getFactorName()),
                        entry.getFactorName(), entry.getMinWeight(), entry.getMaxWeight()));
            }
        }
    }

    /**
     * A search start must carry a weight for every table factor, each inside its bounds
     */
    public void validateStartingVector(WeightVector weights, List<WeightEntry> table) {
        validateVector(weights, table);
        Set<String> missing = table.stream()
                .map(WeightEntry::getFactorName)
                .filter(factor -> !weights.contains(factor))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!missing.isEmpty()) {
            throw new InputValidationException("Starting weights missing table factors: " + missing);
        }
    }
}
