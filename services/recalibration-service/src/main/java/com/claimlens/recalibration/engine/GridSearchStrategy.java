package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.engine.ObjectiveFunction.Evaluation;
import com.claimlens.recalibration.model.ConvergenceStep;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.OptimizationStatus;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sequential Grid Search
 *
 * <p>Visits non-frozen factors one at a time in weight-table order. For each it samples
 * {@code gridSteps + 1} equally spaced weights across {@code [min, max]} (only {@code min} when
 * {@code gridSteps} is 0) with every other factor held at the best vector found so far, and keeps
 * a sample only if it strictly improves the score.
 *
 * <p>This is a greedy one-factor-at-a-time approximation, not a joint grid over all
 * combinations: the result depends on factor order and is not guaranteed to be a joint optimum.
 * The search starts from the baseline score, so it never ends worse than the baseline.
 *
 * <p>{@code iterationsRun} counts sampled weights. A history step is recorded for every accepted
 * sample; its delta is the move from the factor's previous weight.
 */
@Slf4j
@Component
public class GridSearchStrategy implements OptimizationStrategy {

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.GRID_SEARCH;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        int gridSteps = context.getConfig().getGridSteps();
        ObjectiveFunction objective = context.getObjective();

        OptimizationLifecycle lifecycle = new OptimizationLifecycle(method());
        lifecycle.start();

        WeightVector best = context.getStartingWeights();
        Evaluation initial = objective.evaluate(best);
        Evaluation bestEvaluation = initial;

        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder();
        OptimizationStatus terminal = OptimizationStatus.COMPLETED;
        int iteration = 0;

        for (WeightEntry entry : context.optimizableFactors()) {
            if (context.getBudget().isExhausted()) {
                terminal = OptimizationStatus.CANCELLED;
                break;
            }
            String factor = entry.getFactorName();
            for (int i = 0; i <= gridSteps; i++) {
                iteration++;
                double candidate = gridPoint(entry, i, gridSteps);
                double previous = best.get(factor);
                if (candidate == previous) {
                    continue;
                }
                WeightVector trial = best.with(factor, candidate);
                Evaluation evaluation = objective.evaluate(trial);
                if (evaluation.improvesOn(bestEvaluation)) {
                    best = trial;
                    bestEvaluation = evaluation;
                    result.step(ConvergenceStep.builder()
                            .iteration(iteration)
                            .mape(evaluation.getMape())
                            .rmse(evaluation.getRmse())
                            .weightDeltas(Map.of(factor, candidate - previous))
                            .weights(trial)
                            .build());
                }
            }
            log.debug("Grid search settled {} at {} (score {})", factor, best.get(factor), bestEvaluation.getScore());
        }

        lifecycle.finish(terminal);
        if (terminal == OptimizationStatus.CANCELLED) {
            log.warn("Grid search cancelled after {} samples", iteration);
        }

        return result
                .method(method())
                .status(lifecycle.outcome())
                .optimizedWeights(best)
                .iterationsRun(iteration)
                .initialMape(initial.getMape())
                .initialRmse(initial.getRmse())
                .finalMape(bestEvaluation.getMape())
                .finalRmse(bestEvaluation.getRmse())
                .improvementPct(CoordinateDescentStrategy.improvementPct(initial.getMape(), bestEvaluation.getMape()))
                .converged(terminal == OptimizationStatus.COMPLETED)
                .build();
    }

    /**
     * i-th of {@code steps + 1} equally spaced points over the factor's bounds; the last point is
     * exactly {@code max}
     */
    static double gridPoint(WeightEntry entry, int i, int steps) {
        if (steps == 0 || i == 0) {
            return entry.getMinWeight();
        }
        if (i == steps) {
            return entry.getMaxWeight();
        }
        return entry.getMinWeight() + entry.range() * i / steps;
    }
}
