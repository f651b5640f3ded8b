package com.claimlens.recalibration.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OptimizationStatus Unit Tests")
class OptimizationStatusTest {

    @Test
    @DisplayName("Runs go through RUNNING and end in COMPLETED")
    void lifecycle() {
        assertThat(OptimizationStatus.IDLE.canTransitionTo(OptimizationStatus.RUNNING)).isTrue();
        assertThat(OptimizationStatus.IDLE.canTransitionTo(OptimizationStatus.CONVERGED)).isFalse();
        assertThat(OptimizationStatus.RUNNING.allowedTransitions()).containsExactlyInAnyOrder(
                OptimizationStatus.CONVERGED, OptimizationStatus.MAX_ITERATIONS_REACHED,
                OptimizationStatus.CANCELLED, OptimizationStatus.COMPLETED);
        assertThat(OptimizationStatus.CANCELLED.canTransitionTo(OptimizationStatus.COMPLETED)).isTrue();
        assertThat(OptimizationStatus.COMPLETED.allowedTransitions()).isEmpty();
        assertThat(OptimizationStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(OptimizationStatus.CONVERGED.isTerminal()).isFalse();
    }
}
