package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Correlation-Guided Hybrid
 *
 * <p>Ranks non-frozen factors by combined score (correlation with the starting vector's absolute
 * error plus normalized impact, as in {@link FactorImpactRanker}), freezes all but the top
 * {@code topFactorCount} and hands the narrowed problem to coordinate descent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationGuidedStrategy implements OptimizationStrategy {

    private final CoordinateDescentStrategy coordinateDescent;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final FactorImpactRanker factorImpactRanker;

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.CORRELATION_GUIDED;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        OptimizationConfig config = context.getConfig();
        List<ClaimRecord> claims = context.getClaims().claims();
        WeightVector start = context.getStartingWeights();

        double[] predicted = context.getClaims().predict(start);
        List<Double> predictions = new ArrayList<>(predicted.length);
        List<Double> deviations = new ArrayList<>(predicted.length);
        for (int i = 0; i < predicted.length; i++) {
            predictions.add(predicted[i]);
            deviations.add(MetricsEvaluator.absoluteErrorPct(predicted[i], claims.get(i).getActualSettlement()));
        }

        Map<String, Double> correlations = new LinkedHashMap<>();
        for (WeightEntry entry : context.optimizableFactors()) {
            correlations.put(entry.getFactorName(),
                    correlationAnalyzer.correlate(claims, predictions, entry.getFactorName()));
        }
        Map<String, Double> impacts = factorImpactRanker.computeImpacts(claims, start, deviations);

        List<String> ranked = factorImpactRanker.rankFactors(
                context.getWeightTable(), correlations, impacts, config.getFrozenFactors());
        List<String> selected = ranked.subList(0, Math.min(config.getTopFactorCount(), ranked.size()));

        Set<String> frozen = new HashSet<>(config.getFrozenFactors());
        for (WeightEntry entry : context.getWeightTable()) {
            if (!selected.contains(entry.getFactorName())) {
                frozen.add(entry.getFactorName());
            }
        }
        log.info("Correlation-guided optimization selected {} of {} factors: {}",
                selected.size(), context.getWeightTable().size(), selected);

        OptimizationResult narrowed = coordinateDescent.optimize(
                context.withConfig(config.toBuilder().frozenFactors(Set.copyOf(frozen)).build()));
        return narrowed.toBuilder().method(method()).build();
    }
}
