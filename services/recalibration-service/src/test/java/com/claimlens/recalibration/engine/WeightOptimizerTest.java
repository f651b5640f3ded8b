package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.ClaimFixtures;
import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.OptimizationStatus;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WeightOptimizer Unit Tests")
class WeightOptimizerTest {

    @Mock
    private OptimizationStrategy strategy;

    @Captor
    private ArgumentCaptor<OptimizationContext> contextCaptor;

    private WeightOptimizer optimizer;

    @BeforeEach
    void setUp() {
        when(strategy.method()).thenReturn(OptimizationMethod.COORDINATE_DESCENT);
        optimizer = new WeightOptimizer(List.of(strategy), StrategyFixtures.RUNNER, new WeightTableValidator());
    }

    @Test
    @DisplayName("Dispatches to the registered strategy starting from base weights")
    void dispatchesWithBaseWeights() {
        // Given
        when(strategy.optimize(any())).thenReturn(OptimizationResult.builder()
                .method(OptimizationMethod.COORDINATE_DESCENT)
                .status(OptimizationStatus.CONVERGED)
                .optimizedWeights(WeightVector.fromBaseWeights(ClaimFixtures.twoFactorTable()))
                .converged(true)
                .build());

        // When
        OptimizationResult result = optimizer.optimize(ClaimFixtures.twoFactorClaims(), ClaimFixtures.twoFactorTable(),
                OptimizationConfig.builder().build(), OptimizationMethod.COORDINATE_DESCENT);

        // Then
        verify(strategy).optimize(contextCaptor.capture());
        OptimizationContext context = contextCaptor.getValue();
        assertThat(context.getStartingWeights().asMap()).containsEntry("a", 0.5).containsEntry("b", 0.5);
        assertThat(context.getClaims().size()).isEqualTo(3);
        assertThat(context.getBudget().isExhausted()).isFalse();
        assertThat(result.isConverged()).isTrue();
    }

    @Nested
    @DisplayName("Validation happens before any computation")
    class Validation {

        @Test
        @DisplayName("Empty claim set")
        void emptyClaims() {
            assertThatThrownBy(() -> optimizer.optimize(List.of(), ClaimFixtures.twoFactorTable(),
                    OptimizationConfig.builder().build(), OptimizationMethod.COORDINATE_DESCENT))
                    .isInstanceOf(InsufficientDataException.class);
            verify(strategy, never()).optimize(any());
        }

        @Test
        @DisplayName("Minimum above maximum")
        void invertedBounds() {
            List<WeightEntry> table = List.of(WeightEntry.of("a", 0.5, 0.9, 0.1));

            assertThatThrownBy(() -> optimizer.optimize(ClaimFixtures.twoFactorClaims(), table,
                    OptimizationConfig.builder().build(), OptimizationMethod.COORDINATE_DESCENT))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("greater than max_weight");
            verify(strategy, never()).optimize(any());
        }

        @Test
        @DisplayName("Frozen factor missing from the table")
        void unknownFrozenFactor() {
            OptimizationConfig config = OptimizationConfig.builder().frozenFactors(Set.of("zzz")).build();

            assertThatThrownBy(() -> optimizer.optimize(ClaimFixtures.twoFactorClaims(),
                    ClaimFixtures.twoFactorTable(), config, OptimizationMethod.COORDINATE_DESCENT))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("zzz");
            verify(strategy, never()).optimize(any());
        }

        @Test
        @DisplayName("Starting weights that omit a table factor")
        void partialStartingWeights() {
            // Given
            List<WeightEntry> table = List.of(
                    WeightEntry.of("a", 0.5, 0.2, 0.8),
                    WeightEntry.of("b", 0.5, 0.1, 1.0));
            OptimizationConfig config = OptimizationConfig.builder().frozenFactors(Set.of("a")).build();
            WeightVector start = WeightVector.of(Map.of("b", 0.5));

            // When / Then
            assertThatThrownBy(() -> optimizer.optimize(ClaimFixtures.twoFactorClaims(), table, start, config,
                    OptimizationMethod.COORDINATE_DESCENT, OptimizationBudget.unlimited(),
                    StrategyFixtures.RUNNER.defaultCoefficients()))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("[a]");
            verify(strategy, never()).optimize(any());
        }

        @Test
        @DisplayName("Method without a registered strategy")
        void unregisteredMethod() {
            assertThatThrownBy(() -> optimizer.optimize(ClaimFixtures.twoFactorClaims(),
                    ClaimFixtures.twoFactorTable(), OptimizationConfig.builder().build(),
                    OptimizationMethod.GRID_SEARCH))
                    .isInstanceOf(InputValidationException.class);
        }
    }

    @Nested
    @DisplayName("With every production strategy")
    class EndToEnd {

        private WeightOptimizer fullOptimizer;

        @BeforeEach
        void setUp() {
            fullOptimizer = new WeightOptimizer(
                    List.of(StrategyFixtures.coordinateDescent(), new GridSearchStrategy(),
                            StrategyFixtures.correlationGuided()),
                    StrategyFixtures.RUNNER, new WeightTableValidator());
        }

        @ParameterizedTest
        @EnumSource(OptimizationMethod.class)
        @DisplayName("Results stay in bounds and never end worse than the baseline")
        void boundedAndNotWorse(OptimizationMethod method) {
            // Given
            List<WeightEntry> table = ClaimFixtures.twoFactorTable();

            // When
            OptimizationResult result = fullOptimizer.optimize(ClaimFixtures.twoFactorClaims(), table,
                    OptimizationConfig.builder().learningRate(0.1).build(), method);

            // Then
            assertThat(result.getMethod()).isEqualTo(method);
            assertThat(result.getFinalMape()).isLessThanOrEqualTo(result.getInitialMape());
            table.forEach(entry ->
                    assertThat(entry.contains(result.getOptimizedWeights().get(entry.getFactorName()))).isTrue());
        }

        @Test
        @DisplayName("An expired budget yields a cancelled partial result")
        void expiredBudget() {
            OptimizationBudget budget = OptimizationBudget.unlimited();
            budget.cancel();

            OptimizationResult result = fullOptimizer.optimize(ClaimFixtures.twoFactorClaims(),
                    ClaimFixtures.twoFactorTable(), OptimizationConfig.builder().build(),
                    OptimizationMethod.GRID_SEARCH, budget);

            assertThat(result.getStatus()).isEqualTo(OptimizationStatus.CANCELLED);
            assertThat(result.isConverged()).isFalse();
            assertThat(result.getOptimizedWeights().asMap()).containsEntry("a", 0.5).containsEntry("b", 0.5);
        }
    }
}
