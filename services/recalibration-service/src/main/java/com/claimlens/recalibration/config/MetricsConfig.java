package com.claimlens.recalibration.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics Configuration for Recalibration Service
 *
 * <p>Run-level counters are registered up front. The optimizer run timer carries a
 * {@code method} tag and is registered lazily by {@code RecalibrationService}.
 *
 * <ul>
 *   <li>recalibration.optimizer.runs - optimizer runs started</li>
 *   <li>recalibration.optimizer.failures - optimizer runs rejected or failed</li>
 *   <li>recalibration.recalibrations - recalibrations, comparisons and reports served</li>
 *   <li>recalibration.optimizer.run.time - optimizer wall time per method</li>
 * </ul>
 */
@Configuration
@Slf4j
public class MetricsConfig {

    public static final String OPTIMIZER_RUNS = "recalibration.optimizer.runs";
    public static final String OPTIMIZER_FAILURES = "recalibration.optimizer.failures";
    public static final String RECALIBRATIONS = "recalibration.recalibrations";
    public static final String OPTIMIZER_RUN_TIME = "recalibration.optimizer.run.time";

    @Bean
    public Counter optimizerRunsCounter(MeterRegistry registry) {
        return Counter.builder(OPTIMIZER_RUNS)
            .description("Total number of optimizer runs started")
            .tag("service", "recalibration")
            .register(registry);
    }

    @Bean
    public Counter optimizerFailuresCounter(MeterRegistry registry) {
        return Counter.builder(OPTIMIZER_FAILURES)
            .description("Total number of optimizer runs that failed")
            .tag("service", "recalibration")
            .register(registry);
    }

    @Bean
    public Counter recalibrationsCounter(MeterRegistry registry) {
        return Counter.builder(RECALIBRATIONS)
            .description("Total number of weight recalibrations evaluated")
            .tag("service", "recalibration")
            .register(registry);
    }
}
