package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.exception.InputValidationException;
import com.claimlens.recalibration.exception.InsufficientDataException;
import com.claimlens.recalibration.model.OptimizationConfig;
import com.claimlens.recalibration.model.WeightEntry;
import com.claimlens.recalibration.model.WeightVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WeightTableValidator Unit Tests")
class WeightTableValidatorTest {

    private final WeightTableValidator validator = new WeightTableValidator();
    private final List<WeightEntry> table = List.of(
            WeightEntry.of("a", 0.5, 0.1, 1.0),
            WeightEntry.of("b", 0.5, 0.1, 1.0));

    @Test
    @DisplayName("Missing claims are insufficient data")
    void missingClaims() {
        assertThatThrownBy(() -> validator.validateClaims(null))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessage("No claims data available");
    }

    @Nested
    @DisplayName("Weight table")
    class Table {

        @Test
        @DisplayName("Valid table passes")
        void validTable() {
            assertThatCode(() -> validator.validateTable(table)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Duplicate factors are rejected")
        void duplicateFactor() {
            assertThatThrownBy(() -> validator.validateTable(List.of(table.get(0), table.get(0))))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("Base weight outside its bounds is rejected")
        void baseOutsideBounds() {
            assertThatThrownBy(() -> validator.validateTable(List.of(WeightEntry.of("a", 2.0, 0.0, 1.0))))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("outside");
        }

        @Test
        @DisplayName("Empty table is rejected")
        void emptyTable() {
            assertThatThrownBy(() -> validator.validateTable(List.of()))
                    .isInstanceOf(InputValidationException.class);
        }
    }

    @Nested
    @DisplayName("Optimization config")
    class Config {

        @Test
        @DisplayName("Learning rate must be in (0, 1]")
        void learningRate() {
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().learningRate(0.0).build(), table))
                    .isInstanceOf(InputValidationException.class);
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().learningRate(1.5).build(), table))
                    .isInstanceOf(InputValidationException.class);
            assertThatCode(() -> validator.validateConfig(OptimizationConfig.builder().learningRate(1.0).build(), table))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Negative counts and thresholds are rejected")
        void negativeValues() {
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().maxIterations(-1).build(), table))
                    .isInstanceOf(InputValidationException.class);
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().gridSteps(-1).build(), table))
                    .isInstanceOf(InputValidationException.class);
            assertThatThrownBy(() -> validator.validateConfig(
                    OptimizationConfig.builder().convergenceThreshold(Double.NaN).build(), table))
                    .isInstanceOf(InputValidationException.class);
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().topFactorCount(0).build(), table))
                    .isInstanceOf(InputValidationException.class);
        }

        @Test
        @DisplayName("Null frozen factor set is rejected")
        void nullFrozenFactors() {
            assertThatThrownBy(() -> validator.validateConfig(OptimizationConfig.builder().frozenFactors(null).build(), table))
                    .isInstanceOf(InputValidationException.class)
                    .hasMessageContaining("frozen_factors");
        }
    }

    @Test
    @DisplayName("Vector weights must be finite and inside known bounds")
    void vectorBounds() {
        assertThatThrownBy(() -> validator.validateVector(WeightVector.of(Map.of("a", 1.5)), table))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> validator.validateVector(WeightVector.of(Map.of("z", Double.NaN)), table))
                .isInstanceOf(InputValidationException.class);
        assertThatCode(() -> validator.validateVector(WeightVector.of(Map.of("a", 0.3, "z", 7.0)), table))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Starting vector must cover every table factor")
    void startingVectorCoverage() {
        assertThatThrownBy(() -> validator.validateStartingVector(WeightVector.of(Map.of("b", 0.5)), table))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("[a]");
        assertThatCode(() -> validator.validateStartingVector(WeightVector.of(Map.of("a", 0.3, "b", 0.5)), table))
                .doesNotThrowAnyException();
    }
}
