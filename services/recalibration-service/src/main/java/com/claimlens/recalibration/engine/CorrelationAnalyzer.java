package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.model.ClaimRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Pearson correlation between a factor's numeric value and absolute prediction error.
 *
 * <p>Only claims holding a numeric value for the factor (a number or numeric string) and a
 * defined variance % take part. Fewer than two such claims, or a constant series on either
 * side, yields 0.
 */
@Component
public class CorrelationAnalyzer {

    static final int MIN_SAMPLES = 2;

    /**
     * Correlate against the variance of each claim's recorded prediction
     */
    public double correlate(List<ClaimRecord> claims, String factorName) {
        double[] deviations = new double[claims.size()];
        boolean[] defined = new boolean[claims.size()];
        for (int i = 0; i < claims.size(); i++) {
            OptionalDouble variance = claims.get(i).recordedVariancePct();
            defined[i] = variance.isPresent();
            deviations[i] = variance.isPresent() ? Math.abs(variance.getAsDouble()) : 0.0;
        }
        return correlate(claims, factorName, deviations, defined);
    }

    /**
     * Correlate against the variance of the supplied predictions, one per claim
     */
    public double correlate(List<ClaimRecord> claims, List<Double> predictions, String factorName) {
        if (predictions.size() != claims.size()) {
            throw new InputValidationException(String.format(
                    "Prediction count %d does not match claim count %d", predictions.size(), claims.size()));
        }
        double[] deviations = new double[claims.size()];
        boolean[] defined = new boolean[claims.size()];
        for (int i = 0; i < claims.size(); i++) {
            Double errorPct = predictions.get(i) == null ? null
                    : MetricsEvaluator.absoluteErrorPct(predictions.get(i), claims.get(i).getActualSettlement());
            defined[i] = errorPct != null;
            deviations[i] = errorPct == null ? 0.0 : errorPct;
        }
        return correlate(claims, factorName, deviations, defined);
    }

    private double correlate(List<ClaimRecord> claims, String factorName, double[] deviations, boolean[] defined) {
        double[] values = new double[claims.size()];
        double[] errors = new double[claims.size()];
        int n = 0;
        for (int i = 0; i < claims.size(); i++) {
            OptionalDouble value = FeatureValues.parseNumeric(claims.get(i).feature(factorName));
            if (value.isPresent() && defined[i]) {
                values[n] = value.getAsDouble();
                errors[n] = deviations[i];
                n++;
            }
        }
        return pearson(values, errors, n);
    }

    /**
     * Pearson coefficient of the first {@code n} pairs; 0 on fewer than two pairs or zero variance
     */
    static double pearson(double[] x, double[] y, int n) {
        if (n < MIN_SAMPLES || isConstant(x, n) || isConstant(y, n)) {
            return 0.0;
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double numerator = 0.0;
        double sumSqX = 0.0;
        double sumSqY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            numerator += dx * dy;
            sumSqX += dx * dx;
            sumSqY += dy * dy;
        }

        double denominator = Math.sqrt(sumSqX * sumSqY);
        if (denominator == 0.0) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, numerator / denominator));
    }

    // rounding in the mean can leave a constant series with a tiny non-zero spread
    private static boolean isConstant(double[] values, int n) {
        for (int i = 1; i < n; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }
}
