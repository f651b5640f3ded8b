package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.engine.ObjectiveFunction.Evaluation;
import com.claimlens.recalibration.model.ConvergenceStep;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.OptimizationStatus;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinate Descent
 *
 * <p>Each round walks the non-frozen factors in weight-table order. For a factor with bounds
 * {@code [min, max]} it tries {@code w + delta} and {@code w - delta}, with
 * {@code delta = learningRate * (max - min)}, both clamped to the bounds. A move is accepted only
 * if it strictly beats the running best score; when both directions do, the lower score wins
 * (ties go to the increase). Accepted moves apply immediately, so later factors in the same round
 * see them.
 *
 * <p>Moves are always compared against the running best, never against the score the run started
 * from, so accept/reject decisions stay consistent across factors in one round and the recorded
 * score sequence is non-increasing.
 *
 * <p>The run converges when the largest accepted move in a round is below the convergence
 * threshold, and otherwise stops after {@code maxIterations} rounds.
 */
@Slf4j
@Component
public class CoordinateDescentStrategy implements OptimizationStrategy {

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.COORDINATE_DESCENT;
    }

    @Override
    public OptimizationResult optimize(OptimizationContext context) {
        OptimizationConfig config = context.getConfig();
        ObjectiveFunction objective = context.getObjective();
        List<WeightEntry> factors = context.optimizableFactors();

        OptimizationLifecycle lifecycle = new OptimizationLifecycle(method());
        lifecycle.start();

        WeightVector current = context.getStartingWeights();
        Evaluation initial = objective.evaluate(current);
        Evaluation best = initial;

        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder();
        OptimizationStatus terminal = OptimizationStatus.MAX_ITERATIONS_REACHED;
        int iteration = 0;

        while (iteration < config.getMaxIterations()) {
            if (context.getBudget().isExhausted()) {
                terminal = OptimizationStatus.CANCELLED;
                break;
            }
            iteration++;
            Map<String, Double> deltas = new LinkedHashMap<>();

            for (WeightEntry entry : factors) {
                String factor = entry.getFactorName();
                double weight = current.get(factor);
                double delta = config.getLearningRate() * entry.range();

                double increased = entry.clamp(weight + delta);
                double decreased = entry.clamp(weight - delta);

                Evaluation accepted = null;
                double acceptedWeight = weight;

                if (increased != weight) {
                    Evaluation up = objective.evaluate(current.with(factor, increased));
                    if (up.improvesOn(best)) {
                        accepted = up;
                        acceptedWeight = increased;
                    }
                }
                if (decreased != weight) {
                    Evaluation down = objective.evaluate(current.with(factor, decreased));
                    if (down.improvesOn(accepted != null ? accepted : best)) {
                        accepted = down;
                        acceptedWeight = decreased;
                    }
                }

                if (accepted != null) {
                    current = current.with(factor, acceptedWeight);
                    best = accepted;
                    deltas.put(factor, acceptedWeight - weight);
                }
            }

            ConvergenceStep step = ConvergenceStep.builder()
                    .iteration(iteration)
                    .mape(best.getMape())
                    .rmse(best.getRmse())
                    .weightDeltas(Collections.unmodifiableMap(deltas))
                    .weights(current)
                    .build();
            result.step(step);
            log.debug("Coordinate descent round {}: mape={}, rmse={}, moved={}",
                    iteration, best.getMape(), best.getRmse(), deltas.keySet());

            if (step.maxAbsoluteDelta() < config.getConvergenceThreshold()) {
                terminal = OptimizationStatus.CONVERGED;
                break;
            }
        }

        lifecycle.finish(terminal);
        if (terminal != OptimizationStatus.CONVERGED) {
            log.warn("Coordinate descent stopped without converging after {} rounds: {}", iteration, terminal);
        }

        return result
                .method(method())
                .status(lifecycle.outcome())
                .optimizedWeights(current)
                .iterationsRun(iteration)
                .initialMape(initial.getMape())
                .initialRmse(initial.getRmse())
                .finalMape(best.getMape())
                .finalRmse(best.getRmse())
                .improvementPct(improvementPct(initial.getMape(), best.getMape()))
                .converged(terminal == OptimizationStatus.CONVERGED)
                .build();
    }

    static double improvementPct(double initialMape, double finalMape) {
        if (initialMape == 0.0) {
            return 0.0;
        }
        return (initialMape - finalMape) / initialMape * 100.0;
    }
}
