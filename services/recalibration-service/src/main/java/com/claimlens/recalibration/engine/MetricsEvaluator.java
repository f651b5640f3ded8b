package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.EvaluationMetrics;
import com.claimlens.recalibration.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prediction Error Metrics
 *
 * <p>Percentage aggregates (variance %, MAPE) skip claims whose actual settlement is zero;
 * absolute aggregates (MAE, RMSE, R², variance totals) include every claim. Degenerate
 * denominators resolve to 0 rather than NaN.
 */
@Component
public class MetricsEvaluator {

    public EvaluationMetrics evaluate(List<ClaimRecord> claims, List<Double> predictions) {
        if (claims == null || claims.isEmpty()) {
            throw new InsufficientDataException("Cannot evaluate predictions over an empty claim set");
        }
        if (predictions == null || predictions.size() != claims.size()) {
            throw new InputValidationException(String.format(
                    "Prediction count %d does not match claim count %d",
                    predictions == null ? 0 : predictions.size(), claims.size()));
        }
        double[] actual = new double[claims.size()];
        double[] predicted = new double[claims.size()];
        for (int i = 0; i < claims.size(); i++) {
            actual[i] = claims.get(i).getActualSettlement();
            predicted[i] = predictions.get(i) == null ? 0.0 : predictions.get(i);
        }
        return evaluate(actual, predicted);
    }

    /**
     * Array form used on the optimizer's hot path
     */
    public EvaluationMetrics evaluate(double[] actual, double[] predicted) {
        if (actual.length == 0) {
            throw new InsufficientDataException("Cannot evaluate predictions over an empty claim set");
        }
        if (actual.length != predicted.length) {
            throw new InputValidationException(String.format(
                    "Prediction count %d does not match claim count %d", predicted.length, actual.length));
        }

        int n = actual.length;
        double actualMean = 0.0;
        for (double value : actual) {
            actualMean += value;
        }
        actualMean /= n;

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double varianceSum = 0.0;
        double totalSumOfSquares = 0.0;
        double absPctSum = 0.0;
        int pctCount = 0;
        List<Double> variancePcts = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            double error = predicted[i] - actual[i];
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            varianceSum += error;
            totalSumOfSquares += (actual[i] - actualMean) * (actual[i] - actualMean);

            Double variancePct = variancePct(predicted[i], actual[i]);
            variancePcts.add(variancePct);
            if (variancePct != null) {
                absPctSum += Math.abs(variancePct);
                pctCount++;
            }
        }

        double rSquared = totalSumOfSquares == 0.0 ? 0.0 : 1.0 - squaredErrorSum / totalSumOfSquares;

        return EvaluationMetrics.builder()
                .claimCount(n)
                .percentageClaimCount(pctCount)
                .mae(absErrorSum / n)
                .mape(pctCount == 0 ? 0.0 : absPctSum / pctCount)
                .rmse(Math.sqrt(squaredErrorSum / n))
                .rSquared(rSquared)
                .totalVariance(varianceSum)
                .avgVariance(varianceSum / n)
                .variancePcts(Collections.unmodifiableList(variancePcts))
                .build();
    }

    /**
     * (predicted - actual) / actual * 100, or {@code null} when actual is zero
     */
    public static Double variancePct(double predicted, double actual) {
        if (actual == 0.0) {
            return null;
        }
        return (predicted - actual) / actual * 100.0;
    }

    /**
     * Absolute percentage error, or {@code null} when actual is zero
     */
    public static Double absoluteErrorPct(double predicted, double actual) {
        Double variance = variancePct(predicted, actual);
        return variance == null ? null : Math.abs(variance);
    }

    public RiskLevel classifyRisk(double deviationPct) {
        return RiskLevel.classify(deviationPct);
    }
}
