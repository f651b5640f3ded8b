package com.claimlens.recalibration.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a long optimizer run: an optional deadline plus an explicit
 * cancel flag. Optimizers poll it once per outer iteration.
 */
public final class OptimizationBudget {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private OptimizationBudget(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static OptimizationBudget unlimited() {
        return new OptimizationBudget(Clock.systemUTC(), null);
    }

    public static OptimizationBudget withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static OptimizationBudget withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new OptimizationBudget(clock, null);
        }
        return new OptimizationBudget(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExhausted() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
