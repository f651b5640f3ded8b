package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks one run through IDLE -> RUNNING -> outcome -> COMPLETED and remembers the outcome
 */
@Slf4j
final class OptimizationLifecycle {

    private final OptimizationMethod method;
    private OptimizationStatus status = OptimizationStatus.IDLE;
    private OptimizationStatus outcome;

    OptimizationLifecycle(OptimizationMethod method) {
        this.method = method;
    }

    void start() {
        transitionTo(OptimizationStatus.RUNNING);
    }

    /**
     * Record the terminal branch and complete the run
     */
    void finish(OptimizationStatus terminal) {
        if (terminal != OptimizationStatus.COMPLETED) {
            transitionTo(terminal);
        }
        outcome = terminal;
        transitionTo(OptimizationStatus.COMPLETED);
    }

    OptimizationStatus outcome() {
        return outcome;
    }

    OptimizationStatus status() {
        return status;
    }

    private void transitionTo(OptimizationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("%s run cannot move from %s to %s", method, status, next));
        }
        log.debug("{} run: {} -> {}", method, status, next);
        status = next;
    }
}
