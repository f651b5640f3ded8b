package com.claimlens.recalibration.config.properties;

import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.ScoringCoefficients;
import com.claimlens.recalibration.model.TargetMetric;
import com.claimlens.recalibration.model.WeightEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recalibration engine settings bound from {@code claimlens.recalibration.*}
 *
 * <pre>
 * claimlens:
 *   recalibration:
 *     coefficients: { c0: 10.5, c1: 0.15, ... }
 *     optimization: { target-metric: MAPE, max-iterations: 100, learning-rate: 0.05, ... }
 *     sensitivity: { perturbation: 0.1 }
 *     weight-table:
 *       - { factor-name: severity_code, base-weight: 0.1, min-weight: 0.0, max-weight: 0.3 }
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "claimlens.recalibration")
public class RecalibrationProperties {

    @Valid
    @NotNull
    private ScoringCoefficients coefficients = new ScoringCoefficients();

    @Valid
    private Optimization optimization = new Optimization();

    @Valid
    private Sensitivity sensitivity = new Sensitivity();

    @Valid
    private List<Factor> weightTable = new ArrayList<>();

    public List<WeightEntry> toWeightTable() {
        return weightTable.stream().map(Factor::toEntry).collect(Collectors.toList());
    }

    @Data
    public static class Optimization {

        @NotNull
        private TargetMetric targetMetric = TargetMetric.MAPE;

        @Min(0)
        private int maxIterations = 100;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double learningRate = 0.05;

        @DecimalMin("0.0")
        private double convergenceThreshold = 0.001;

        @Min(0)
        private int gridSteps = 5;

        @Min(1)
        private int topFactorCount = 10;

        /**
         * Wall-clock limit for one optimizer run; zero or unset means unlimited
         */
        private Duration runTimeout = Duration.ofSeconds(30);

        public OptimizationConfig toConfig() {
            return OptimizationConfig.builder()
                    .targetMetric(targetMetric)
                    .maxIterations(maxIterations)
                    .learningRate(learningRate)
                    .convergenceThreshold(convergenceThreshold)
                    .gridSteps(gridSteps)
                    .topFactorCount(topFactorCount)
                    .build();
        }
    }

    @Data
    public static class Sensitivity {

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double perturbation = 0.1;
    }

    @Data
    public static class Factor {

        @NotBlank
        private String factorName;

        private double baseWeight;
        private double minWeight;
        private double maxWeight;
        private String category;
        private String description;

        WeightEntry toEntry() {
            return WeightEntry.builder()
                    .factorName(factorName)
                    .baseWeight(baseWeight)
                    .minWeight(minWeight)
                    .maxWeight(maxWeight)
                    .category(category)
                    .description(description)
                    .build();
        }
    }
}
