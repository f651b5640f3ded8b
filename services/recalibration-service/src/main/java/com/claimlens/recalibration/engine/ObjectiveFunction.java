package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.EvaluationMetrics;
import com.claimlens.recalibration.model.TargetMetric;
import com.claimlens.recalibration.model.WeightVector;
import lombok.Value;

/**
 * Scores a candidate weight vector over a prepared claim set. Lower is better.
 */
public final class ObjectiveFunction {

    private final PreparedClaims claims;
    private final MetricsEvaluator evaluator;
    private final TargetMetric target;
    private int evaluations;

    ObjectiveFunction(PreparedClaims claims, MetricsEvaluator evaluator, TargetMetric target) {
        this.claims = claims;
        this.evaluator = evaluator;
        this.target = target;
    }

    public Evaluation evaluate(WeightVector weights) {
        evaluations++;
        EvaluationMetrics metrics = evaluator.evaluate(claims.actualView(), claims.predict(weights));
        return new Evaluation(metrics.getMape(), metrics.getRmse(), target.score(metrics.getMape(), metrics.getRmse()));
    }

    public TargetMetric target() {
        return target;
    }

    public int evaluations() {
        return evaluations;
    }

    @Value
    public static class Evaluation {
        double mape;
        double rmse;
        double score;

        public boolean improvesOn(Evaluation other) {
            return score < other.score;
        }
    }
}
