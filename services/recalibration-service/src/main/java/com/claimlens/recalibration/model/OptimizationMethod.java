package com.claimlens.recalibration.model;

import com.claimlens.recalibration.exception.InputValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Weight search strategies and the request names that select them
 */
public enum OptimizationMethod {
    COORDINATE_DESCENT("coordinate_descent", List.of("gradient_descent", "variance_minimization")),
    GRID_SEARCH("grid_search", List.of("grid")),
    CORRELATION_GUIDED("correlation_guided", List.of("smart", "hybrid"));

    private final String methodName;
    private final List<String> aliases;

    OptimizationMethod(String methodName, List<String> aliases) {
        this.methodName = methodName;
        this.aliases = aliases;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * Resolve a request's method name; blank selects coordinate descent
     */
    public static OptimizationMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            return COORDINATE_DESCENT;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(m -> m.methodName.equals(normalized) || m.aliases.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new InputValidationException("Unknown optimization method: " + name));
    }
}
