package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.WeightVector;

import java.util.List;

/**
 * Claim set with everything that does not depend on weights computed once.
 *
 * <p>Between optimizer evaluations only the weight-driven multiplier changes, so each claim's
 * closed-form prediction and factor scores are cached here. Predictions produced from this cache
 * equal {@link ScoringModel#predict} for vectors over the prepared factors.
 */
public final class PreparedClaims {

    private final List<ClaimRecord> claims;
    private final List<String> factors;
    private final double[] actual;
    private final double[] closedForm;
    private final double[][] factorScores;

    private PreparedClaims(List<ClaimRecord> claims, List<String> factors, double[] actual,
                           double[] closedForm, double[][] factorScores) {
        this.claims = claims;
        this.factors = factors;
        this.actual = actual;
        this.closedForm = closedForm;
        this.factorScores = factorScores;
    }

    public static PreparedClaims prepare(ScoringModel model, List<ClaimRecord> claims,
                                         List<String> factors, ScoringCoefficients coefficients) {
        int n = claims.size();
        double[] actual = new double[n];
        double[] closedForm = new double[n];
        double[][] scores = new double[n][factors.size()];
        for (int i = 0; i < n; i++) {
            ClaimRecord claim = claims.get(i);
            actual[i] = claim.getActualSettlement();
            closedForm[i] = model.closedFormPrediction(claim, coefficients);
            for (int f = 0; f < factors.size(); f++) {
                scores[i][f] = FeatureValues.toFactorScore(claim.feature(factors.get(f)));
            }
        }
        return new PreparedClaims(List.copyOf(claims), List.copyOf(factors),
                actual, closedForm, scores);
    }

    public double[] predict(WeightVector weights) {
        double[] w = new double[factors.size()];
        double totalWeight = 0.0;
        for (int f = 0; f < factors.size(); f++) {
            w[f] = weights.get(factors.get(f));
            totalWeight += w[f];
        }

        double[] predictions = new double[closedForm.length];
        for (int i = 0; i < closedForm.length; i++) {
            double weighted = 0.0;
            if (totalWeight > 0.0) {
                double score = 0.0;
                for (int f = 0; f < w.length; f++) {
                    score += factorScores[i][f] * w[f];
                }
                weighted = score / totalWeight;
            }
            predictions[i] = ScoringModel.combine(closedForm[i], weighted);
        }
        return predictions;
    }

    public double factorScore(int claimIndex, String factor) {
        int f = factors.indexOf(factor);
        return f < 0 ? 0.0 : factorScores[claimIndex][f];
    }

    public List<ClaimRecord> claims() {
        return claims;
    }

    public List<String> factors() {
        return factors;
    }

    public double[] actual() {
        return actual.clone();
    }

    double[] actualView() {
        return actual;
    }

    public int size() {
        return claims.size();
    }
}
