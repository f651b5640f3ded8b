package com.claimlens.recalibration.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one optimizer run:
 * IDLE -> RUNNING -> {CONVERGED | MAX_ITERATIONS_REACHED | CANCELLED} -> COMPLETED.
 * Grid search has no convergence test and goes straight from RUNNING to COMPLETED.
 */
public enum OptimizationStatus {
    IDLE,
    RUNNING,
    CONVERGED,
    MAX_ITERATIONS_REACHED,
    CANCELLED,
    COMPLETED;

    public Set<OptimizationStatus> allowedTransitions() {
        return switch (this) {
            case IDLE -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(CONVERGED, MAX_ITERATIONS_REACHED, CANCELLED, COMPLETED);
            case CONVERGED, MAX_ITERATIONS_REACHED, CANCELLED -> EnumSet.of(COMPLETED);
            case COMPLETED -> EnumSet.noneOf(OptimizationStatus.class);
        };
    }

    public boolean canTransitionTo(OptimizationStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
