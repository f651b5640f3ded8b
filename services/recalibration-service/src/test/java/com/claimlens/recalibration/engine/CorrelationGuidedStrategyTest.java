package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.ClaimFixtures;
import com.claimlens.recalibration.model.ClaimRecord;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.WeightEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationGuidedStrategy Unit Tests")
class CorrelationGuidedStrategyTest {

    private final CorrelationGuidedStrategy strategy = StrategyFixtures.correlationGuided();

    @Test
    @DisplayName("Only the top ten factors are optimized; the rest keep their base weight")
    void optimizesTopTenOnly() {
        // Given
        List<WeightEntry> table = new ArrayList<>();
        for (int f = 1; f <= 12; f++) {
            table.add(WeightEntry.of("f" + f, 0.5, 0.0, 1.0));
        }
        double base = ClaimFixtures.closedFormOfEmptyClaim(ScoringCoefficients.defaults());
        List<ClaimRecord> claims = new ArrayList<>();
        for (int k = 0; k < 6; k++) {
            Map<String, Object> features = new HashMap<>();
            for (int f = 1; f <= 10; f++) {
                features.put("f" + f, ((f * (k + 1)) % 7) / 7.0);
            }
            claims.add(ClaimFixtures.claim("CLM-" + k, base * (1.2 + 0.1 * k), features));
        }

        // When
        OptimizationResult result = strategy.optimize(StrategyFixtures.context(claims, table,
                OptimizationConfig.builder().learningRate(0.1).build()));

        // Then
        assertThat(result.getMethod()).isEqualTo(OptimizationMethod.CORRELATION_GUIDED);
        assertThat(result.getOptimizedWeights().get("f11")).isEqualTo(0.5);
        assertThat(result.getOptimizedWeights().get("f12")).isEqualTo(0.5);
        assertThat(result.getFinalMape()).isLessThanOrEqualTo(result.getInitialMape());
        table.forEach(entry -> assertThat(entry.contains(result.getOptimizedWeights().get(entry.getFactorName()))).isTrue());
    }

    @Test
    @DisplayName("User-frozen factors stay frozen and never count toward the top N")
    void respectsUserFrozenFactors() {
        OptimizationResult result = strategy.optimize(StrategyFixtures.context(
                ClaimFixtures.twoFactorClaims(), ClaimFixtures.twoFactorTable(),
                OptimizationConfig.builder()
                        .learningRate(0.1)
                        .topFactorCount(1)
                        .frozenFactors(Set.of("a"))
                        .build()));

        assertThat(result.getOptimizedWeights().get("a")).isEqualTo(0.5);
        assertThat(result.getOptimizedWeights().get("b")).isLessThan(0.5);
        assertThat(result.getFinalMape()).isLessThan(result.getInitialMape());
    }
}
