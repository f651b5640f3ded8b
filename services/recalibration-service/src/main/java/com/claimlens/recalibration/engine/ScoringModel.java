package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.WeightVector;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Settlement Scoring Model
 *
 * <p>Predicts a claim's settlement in two stages:
 * <ol>
 *   <li>a closed-form term {@code exp(E) * (1 + ratingWeight) * (1 + 0.1 * causationSum)} where
 *       {@code E = C0 + C1*S + C2*I + C3*S*I + C4*I^2 + C5*I^3 + C6*S^2}, fixed per claim for a
 *       given coefficient set;</li>
 *   <li>a weight-driven multiplier {@code 1 + sum(value_f * w_f) / sum(w_f)} over the factors of
 *       the weight vector, which is the only part an optimizer can move.</li>
 * </ol>
 *
 * <p>A claim with none of the optional fields has S = 0 and the default I = 2, so it scores
 * {@code exp(C0 + 2*C2 + 4*C4 + 8*C5)}, which is {@code exp(C0)} only when those impact
 * coefficients are zero.
 * The model is stateless and deterministic.
 */
@Component
public class ScoringModel {

    public static final String SEVERITY_SCORE = "SEVERITY_SCORE";
    public static final String IMPACT = "IMPACT";
    public static final String RATING_WEIGHT = "RATINGWEIGHT";

    public static final List<String> SEVERITY_FACTORS = List.of(
            "severity_allowed_tx_period",
            "severity_initial_tx",
            "severity_injections",
            "severity_objective_findings",
            "severity_pain_mgmt",
            "severity_type_tx",
            "severity_injury_site",
            "severity_code");

    public static final List<String> CAUSATION_FACTORS = List.of(
            "causation_probability",
            "causation_tx_delay",
            "causation_tx_gaps",
            "causation_compliance");

    static final int DEFAULT_IMPACT = 2;
    static final int MIN_IMPACT = 1;
    static final int MAX_IMPACT = 4;
    static final double CAUSATION_MULTIPLIER = 0.1;

    public double predict(ClaimRecord claim, WeightVector weights, ScoringCoefficients coefficients) {
        return combine(closedFormPrediction(claim, coefficients), weightedFactorScore(claim, weights));
    }

    /**
     * Final prediction from its two stages, floored at zero so negative multipliers never leak out
     */
    static double combine(double closedFormPrediction, double weightedFactorScore) {
        return Math.max(0.0, closedFormPrediction * (1.0 + weightedFactorScore));
    }

    /**
     * Prediction before the weight-driven multiplier
     */
    public double closedFormPrediction(ClaimRecord claim, ScoringCoefficients coefficients) {
        double s = severitySum(claim);
        int i = impactScore(claim);

        double exponent = coefficients.getC0()
                + coefficients.getC1() * s
                + coefficients.getC2() * i
                + coefficients.getC3() * s * i
                + coefficients.getC4() * i * i
                + coefficients.getC5() * i * i * i
                + coefficients.getC6() * s * s;

        double prediction = Math.exp(exponent)
                * (1.0 + ratingWeight(claim))
                * (1.0 + CAUSATION_MULTIPLIER * causationSum(claim));
        return Math.max(0.0, prediction);
    }

    /**
     * Weight-normalized factor score; 0 when the weights sum to zero or less
     */
    public double weightedFactorScore(ClaimRecord claim, WeightVector weights) {
        double totalScore = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<String, Double> entry : weights.asMap().entrySet()) {
            double weight = entry.getValue();
            totalScore += FeatureValues.toFactorScore(claim.feature(entry.getKey())) * weight;
            totalWeight += weight;
        }
        return totalWeight > 0.0 ? totalScore / totalWeight : 0.0;
    }

    public double severitySum(ClaimRecord claim) {
        double sum = FeatureValues.toDouble(claim.feature(SEVERITY_SCORE));
        for (String factor : SEVERITY_FACTORS) {
            sum += FeatureValues.toDouble(claim.feature(factor));
        }
        return sum;
    }

    public double causationSum(ClaimRecord claim) {
        double sum = 0.0;
        for (String factor : CAUSATION_FACTORS) {
            sum += FeatureValues.toDouble(claim.feature(factor));
        }
        return sum;
    }

    /**
     * Impact truncated to an integer and clamped to [1, 4]; missing or unreadable means 2
     */
    public int impactScore(ClaimRecord claim) {
        return FeatureValues.parseNumeric(claim.feature(IMPACT))
                .stream()
                .mapToInt(value -> (int) value)
                .map(value -> Math.max(MIN_IMPACT, Math.min(MAX_IMPACT, value)))
                .findFirst()
                .orElse(DEFAULT_IMPACT);
    }

    public double ratingWeight(ClaimRecord claim) {
        return FeatureValues.toDouble(claim.feature(RATING_WEIGHT));
    }
}
