package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.ClaimFixtures;
import com.claimlens.recalibration.model.ConvergenceStep;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;
import com.claimlens.recalibration.model.OptimizationStatus;
import com.claimlens.recalibration.model.WeightEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GridSearchStrategy Unit Tests")
class GridSearchStrategyTest {

    private final GridSearchStrategy strategy = new GridSearchStrategy();
    private final List<WeightEntry> table = ClaimFixtures.twoFactorTable();

    private OptimizationResult run(int gridSteps) {
        return strategy.optimize(StrategyFixtures.context(ClaimFixtures.twoFactorClaims(), table,
                OptimizationConfig.builder().gridSteps(gridSteps).build()));
    }

    @Test
    @DisplayName("Zero grid steps samples only each factor's minimum")
    void zeroStepsSamplesMinimumOnly() {
        // When
        OptimizationResult result = run(0);

        // Then
        assertThat(result.getIterationsRun()).isEqualTo(2);
        assertThat(result.getOptimizedWeights().get("a")).isEqualTo(0.5);
        assertThat(result.getOptimizedWeights().get("b")).isEqualTo(0.1);
        assertThat(result.getConvergenceHistory()).singleElement().satisfies(step ->
                assertThat(step.getWeightDeltas().get("b")).isCloseTo(-0.4, within(1e-12)));
        assertThat(result.getFinalMape()).isLessThan(result.getInitialMape());
    }

    @Test
    @DisplayName("Accepted samples never worsen the running best")
    void neverWorsens() {
        OptimizationResult result = run(4);

        assertThat(result.getFinalMape()).isLessThanOrEqualTo(result.getInitialMape());
        List<ConvergenceStep> history = result.getConvergenceHistory();
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).getMape()).isLessThan(history.get(i - 1).getMape());
        }
    }

    @Test
    @DisplayName("Grid runs complete and count every sampled weight")
    void completesAndCountsSamples() {
        OptimizationResult result = run(4);

        assertThat(result.getMethod()).isEqualTo(OptimizationMethod.GRID_SEARCH);
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.COMPLETED);
        assertThat(result.isConverged()).isTrue();
        assertThat(result.getIterationsRun()).isEqualTo(10);
        table.forEach(entry -> assertThat(entry.contains(result.getOptimizedWeights().get(entry.getFactorName()))).isTrue());
    }

    @Test
    @DisplayName("Grid points are evenly spaced and end exactly on the bounds")
    void gridPoints() {
        WeightEntry entry = WeightEntry.of("a", 0.5, 0.1, 1.0);

        assertThat(GridSearchStrategy.gridPoint(entry, 0, 4)).isEqualTo(0.1);
        assertThat(GridSearchStrategy.gridPoint(entry, 2, 4)).isCloseTo(0.55, within(1e-12));
        assertThat(GridSearchStrategy.gridPoint(entry, 4, 4)).isEqualTo(1.0);
        assertThat(GridSearchStrategy.gridPoint(entry, 0, 0)).isEqualTo(0.1);
    }
}
