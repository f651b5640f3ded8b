package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.ClaimOutcome;
import com.claimlens.recalibration.model.ClaimRecalibration;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.EvaluationMetrics;
import com.claimlens.recalibration.model.RecalibrationMetrics;
import com.claimlens.recalibration.model.RecalibrationReport;
import com.claimlens.recalibration.model.RiskLevel;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.TargetMetric;
import com.claimlens.recalibration.model.WeightVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recalibration Runner
 *
 * <p>Scores a claim set under a baseline and a candidate weight vector and compares the two.
 * A claim is IMPROVED when its absolute error drops by more than one percentage point,
 * DEGRADED when it rises by more than one, UNCHANGED otherwise. Claims with a zero actual
 * settlement have no percentage error and always count as UNCHANGED.
 *
 * <p>Also builds the {@link ObjectiveFunction} optimizers use, so standalone comparisons and
 * the optimizer's inner loop share one evaluation path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecalibrationRunner {

    static final double OUTCOME_THRESHOLD_PCT = 1.0;

    private final ScoringModel scoringModel;
    private final MetricsEvaluator metricsEvaluator;
    private final ScoringCoefficients coefficients;

    public RecalibrationReport run(List<ClaimRecord> claims, WeightVector baseline, WeightVector candidate) {
        return run(claims, baseline, candidate, coefficients);
    }

    public RecalibrationReport run(List<ClaimRecord> claims, WeightVector baseline, WeightVector candidate,
                                   ScoringCoefficients runCoefficients) {
        if (claims == null || claims.isEmpty()) {
            throw new InsufficientDataException("Cannot recalibrate an empty claim set");
        }
        PreparedClaims prepared = prepare(claims, unionOf(baseline, candidate), runCoefficients);
        double[] baselinePredictions = prepared.predict(baseline);
        double[] candidatePredictions = prepared.predict(candidate);

        EvaluationMetrics before = metricsEvaluator.evaluate(prepared.actualView(), baselinePredictions);
        EvaluationMetrics after = metricsEvaluator.evaluate(prepared.actualView(), candidatePredictions);

        List<ClaimRecalibration> lines = new ArrayList<>(claims.size());
        int improved = 0;
        int degraded = 0;
        int unchanged = 0;
        double improvementSum = 0.0;
        int percentageClaims = 0;

        for (int i = 0; i < claims.size(); i++) {
            ClaimRecord claim = claims.get(i);
            double actual = claim.getActualSettlement();
            Double baselineErrorPct = MetricsEvaluator.absoluteErrorPct(baselinePredictions[i], actual);
            Double candidateErrorPct = MetricsEvaluator.absoluteErrorPct(candidatePredictions[i], actual);

            double improvement = 0.0;
            ClaimOutcome outcome = ClaimOutcome.UNCHANGED;
            if (baselineErrorPct != null) {
                improvement = baselineErrorPct - candidateErrorPct;
                improvementSum += improvement;
                percentageClaims++;
                outcome = classify(improvement);
            }
            switch (outcome) {
                case IMPROVED -> improved++;
                case DEGRADED -> degraded++;
                default -> unchanged++;
            }

            lines.add(ClaimRecalibration.builder()
                    .claimId(claim.getClaimId())
                    .actualSettlement(actual)
                    .baselinePrediction(baselinePredictions[i])
                    .candidatePrediction(candidatePredictions[i])
                    .baselineErrorPct(baselineErrorPct)
                    .candidateErrorPct(candidateErrorPct)
                    .improvementPct(improvement)
                    .outcome(outcome)
                    .baselineRisk(baselineErrorPct == null ? null : RiskLevel.classify(baselineErrorPct))
                    .candidateRisk(candidateErrorPct == null ? null : RiskLevel.classify(candidateErrorPct))
                    .build());
        }

        RecalibrationMetrics metrics = RecalibrationMetrics.builder()
                .totalClaims(claims.size())
                .improvedCount(improved)
                .degradedCount(degraded)
                .unchangedCount(unchanged)
                .avgImprovementPct(percentageClaims == 0 ? 0.0 : improvementSum / percentageClaims)
                .mapeBefore(before.getMape())
                .mapeAfter(after.getMape())
                .rmseBefore(before.getRmse())
                .rmseAfter(after.getRmse())
                .build();

        log.debug("Recalibrated {} claims: improved={}, degraded={}, unchanged={}, mape {} -> {}",
                claims.size(), improved, degraded, unchanged, before.getMape(), after.getMape());

        return RecalibrationReport.builder()
                .metrics(metrics)
                .claims(List.copyOf(lines))
                .baselineEvaluation(before)
                .candidateEvaluation(after)
                .build();
    }

    /**
     * Error metrics of a single weight vector
     */
    public EvaluationMetrics evaluate(List<ClaimRecord> claims, WeightVector weights) {
        if (claims == null || claims.isEmpty()) {
            throw new InsufficientDataException("Cannot evaluate an empty claim set");
        }
        PreparedClaims prepared = prepare(claims, new ArrayList<>(weights.factorNames()), coefficients);
        return evaluate(prepared, weights);
    }

    public EvaluationMetrics evaluate(PreparedClaims prepared, WeightVector weights) {
        return metricsEvaluator.evaluate(prepared.actualView(), prepared.predict(weights));
    }

    public PreparedClaims prepare(List<ClaimRecord> claims, List<String> factors, ScoringCoefficients runCoefficients) {
        return PreparedClaims.prepare(scoringModel, claims, factors, runCoefficients);
    }

    public ObjectiveFunction objective(PreparedClaims prepared, TargetMetric target) {
        return new ObjectiveFunction(prepared, metricsEvaluator, target);
    }

    public ScoringCoefficients defaultCoefficients() {
        return coefficients;
    }

    private static ClaimOutcome classify(double improvementPct) {
        if (improvementPct > OUTCOME_THRESHOLD_PCT) {
            return ClaimOutcome.IMPROVED;
        }
        if (improvementPct < -OUTCOME_THRESHOLD_PCT) {
            return ClaimOutcome.DEGRADED;
        }
        return ClaimOutcome.UNCHANGED;
    }

    private static List<String> unionOf(WeightVector first, WeightVector second) {
        Set<String> factors = new LinkedHashSet<>(first.factorNames());
        factors.addAll(second.factorNames());
        return new ArrayList<>(factors);
    }
}
