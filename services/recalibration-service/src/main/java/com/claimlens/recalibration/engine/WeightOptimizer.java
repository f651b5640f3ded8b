package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Weight Optimizer
 *
 * <p>Validates a run's inputs, prepares the claim set once and dispatches to the strategy
 * registered for the requested {@link OptimizationMethod}. Every strategy shares the same
 * {@link ObjectiveFunction}, so MAPE/RMSE/BOTH scoring is identical across methods.
 */
@Slf4j
@Component
public class WeightOptimizer {

    private final Map<OptimizationMethod, OptimizationStrategy> strategies;
    private final RecalibrationRunner runner;
    private final WeightTableValidator validator;

    public WeightOptimizer(List<OptimizationStrategy> strategies, RecalibrationRunner runner,
                           WeightTableValidator validator) {
        this.strategies = new EnumMap<>(OptimizationMethod.class);
        strategies.forEach(strategy -> this.strategies.put(strategy.method(), strategy));
        this.runner = runner;
        this.validator = validator;
    }

    public OptimizationResult optimize(List<ClaimRecord> claims, List<WeightEntry> table,
                                       OptimizationConfig config, OptimizationMethod method) {
        return optimize(claims, table, config, method, OptimizationBudget.unlimited());
    }

    public OptimizationResult optimize(List<ClaimRecord> claims, List<WeightEntry> table,
                                       OptimizationConfig config, OptimizationMethod method,
                                       OptimizationBudget budget) {
        return optimize(claims, table, WeightVector.fromBaseWeights(table), config, method, budget,
                runner.defaultCoefficients());
    }

    /**
     * Full form: search from {@code startingWeights} (defaults to the table's base weights when
     * null) under the given coefficients
     */
    public OptimizationResult optimize(List<ClaimRecord> claims, List<WeightEntry> table, WeightVector startingWeights,
                                       OptimizationConfig config, OptimizationMethod method,
                                       OptimizationBudget budget, ScoringCoefficients coefficients) {
        validator.validateClaims(claims);
        validator.validateTable(table);
        validator.validateConfig(config, table);
        WeightVector start = startingWeights == null ? WeightVector.fromBaseWeights(table) : startingWeights;
        validator.validateStartingVector(start, table);

        OptimizationStrategy strategy = strategies.get(method);
        if (strategy == null) {
            throw new InputValidationException("No optimizer registered for method " + method);
        }

        List<String> factors = table.stream().map(WeightEntry::getFactorName).collect(Collectors.toList());
        PreparedClaims prepared = runner.prepare(claims, factors, coefficients);
        ObjectiveFunction objective = runner.objective(prepared, config.getTargetMetric());

        log.info("Starting {} optimization: claims={}, factors={}, frozen={}, target={}",
                method.getMethodName(), claims.size(), factors.size(), config.getFrozenFactors().size(),
                config.getTargetMetric());

        OptimizationResult result = strategy.optimize(OptimizationContext.builder()
                .weightTable(List.copyOf(table))
                .config(config)
                .claims(prepared)
                .objective(objective)
                .budget(budget == null ? OptimizationBudget.unlimited() : budget)
                .startingWeights(start)
                .build());

        log.info("Finished {} optimization: status={}, iterations={}, evaluations={}, mape {} -> {} ({}%)",
                method.getMethodName(), result.getStatus(), result.getIterationsRun(), objective.evaluations(),
                result.getInitialMape(), result.getFinalMape(), result.getImprovementPct());
        if (!result.isConverged()) {
            log.warn("{} optimization did not converge: {}", method.getMethodName(), result.getStatus());
        }
        return result;
    }
}
