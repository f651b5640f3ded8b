package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds real engine collaborators and optimizer contexts for strategy tests
 */
final class StrategyFixtures {

    static final RecalibrationRunner RUNNER =
            new RecalibrationRunner(new ScoringModel(), new MetricsEvaluator(), ScoringCoefficients.defaults());

    private StrategyFixtures() {
    }

    static OptimizationContext context(List<ClaimRecord> claims, List<WeightEntry> table, OptimizationConfig config) {
        return context(claims, table, config, OptimizationBudget.unlimited());
    }

    static OptimizationContext context(List<ClaimRecord> claims, List<WeightEntry> table, OptimizationConfig config,
                                       OptimizationBudget budget) {
        List<String> factors = table.stream().map(WeightEntry::getFactorName).collect(Collectors.toList());
        PreparedClaims prepared = RUNNER.prepare(claims, factors, ScoringCoefficients.defaults());
        return OptimizationContext.builder()
                .weightTable(table)
                .config(config)
                .claims(prepared)
                .objective(RUNNER.objective(prepared, config.getTargetMetric()))
                .budget(budget)
                .startingWeights(WeightVector.fromBaseWeights(table))
                .build();
    }

    static CoordinateDescentStrategy coordinateDescent() {
        return new CoordinateDescentStrategy();
    }

    static CorrelationGuidedStrategy correlationGuided() {
        return new CorrelationGuidedStrategy(coordinateDescent(), new CorrelationAnalyzer(), new FactorImpactRanker());
    }
}
