package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.ClaimFixtures;
import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.EvaluationMetrics;
import com.claimlens.recalibration.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MetricsEvaluator Unit Tests")
class MetricsEvaluatorTest {

    private final MetricsEvaluator evaluator = new MetricsEvaluator();

    @Test
    @DisplayName("Two-claim scenario: MAPE 22.5%, RMSE 38013.16")
    void twoClaimScenario() {
        // Given
        List<ClaimRecord> claims = List.of(
                ClaimFixtures.claim("CLM-1", 100_000, Map.of()),
                ClaimFixtures.claim("CLM-2", 200_000, Map.of()));

        // When
        EvaluationMetrics metrics = evaluator.evaluate(claims, List.of(120_000.0, 150_000.0));

        // Then
        assertThat(metrics.getMape()).isCloseTo(22.5, within(1e-9));
        assertThat(metrics.getRmse()).isCloseTo(38013.16, within(0.01));
        assertThat(metrics.getMae()).isCloseTo(35_000.0, within(1e-9));
        assertThat(metrics.getTotalVariance()).isCloseTo(-30_000.0, within(1e-9));
        assertThat(metrics.getAvgVariance()).isCloseTo(-15_000.0, within(1e-9));
        assertThat(metrics.getVariancePcts()).containsExactly(20.0, -25.0);
    }

    @Test
    @DisplayName("R squared is 1 for a perfect fit and 0 when actual values are constant")
    void rSquared() {
        EvaluationMetrics perfect = evaluator.evaluate(new double[]{1, 2, 3}, new double[]{1, 2, 3});
        EvaluationMetrics constant = evaluator.evaluate(new double[]{5, 5}, new double[]{4, 6});

        assertThat(perfect.getRSquared()).isEqualTo(1.0);
        assertThat(constant.getRSquared()).isZero();
    }

    @Test
    @DisplayName("Zero actual settlements stay out of percentage metrics only")
    void zeroActualExcludedFromPercentages() {
        // When
        EvaluationMetrics metrics = evaluator.evaluate(new double[]{0, 100}, new double[]{50, 110});

        // Then
        assertThat(metrics.getClaimCount()).isEqualTo(2);
        assertThat(metrics.getPercentageClaimCount()).isEqualTo(1);
        assertThat(metrics.getMape()).isCloseTo(10.0, within(1e-9));
        assertThat(metrics.getMae()).isCloseTo(30.0, within(1e-9));
        assertThat(metrics.getVariancePcts()).containsExactly(null, 10.0);
    }

    @Test
    @DisplayName("MAPE is 0 when no claim has a percentage basis")
    void mapeWithoutPercentageClaims() {
        EvaluationMetrics metrics = evaluator.evaluate(new double[]{0, 0}, new double[]{10, 20});

        assertThat(metrics.getMape()).isZero();
        assertThat(metrics.getRmse()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Empty claim set is rejected")
    void emptyClaimSet() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(), List.of()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Prediction count must match claim count")
    void sizeMismatch() {
        List<ClaimRecord> claims = List.of(ClaimFixtures.claim("CLM-1", 100, Map.of()));

        assertThatThrownBy(() -> evaluator.evaluate(claims, Arrays.asList(1.0, 2.0)))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    @DisplayName("Risk boundaries are exclusive")
    void riskBoundaries() {
        assertThat(evaluator.classifyRisk(30.0)).isEqualTo(RiskLevel.HIGH);
        assertThat(evaluator.classifyRisk(30.01)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(evaluator.classifyRisk(20.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(evaluator.classifyRisk(10.0)).isEqualTo(RiskLevel.LOW);
        assertThat(evaluator.classifyRisk(-45.0)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.HIGH.getLabel()).isEqualTo("High Risk");
    }
}
