package com.claimlens.recalibration.engine;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * The one place claim feature values are turned into numbers.
 *
 * <p>Claim features mix numbers, numeric strings and categorical text, and any of them may be
 * missing. Every coercion here is total: it never throws and never yields NaN or infinity.
 */
public final class FeatureValues {

    private FeatureValues() {
    }

    /**
     * Numeric value of a feature, or empty when it is missing, non-numeric or not finite
     */
    public static OptionalDouble parseNumeric(Object value) {
        if (value instanceof Number number) {
            return finite(number.doubleValue());
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                return finite(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Numeric value of a feature, 0 when it cannot be read as a number
     */
    public static double toDouble(Object value) {
        return parseNumeric(value).orElse(0.0);
    }

    /**
     * Score of a possibly categorical feature. Numbers pass through unchanged; known category
     * phrases map onto [0, 1]; other text is parsed as a number clamped to [0, 1], else 0.
     */
    public static double toFactorScore(Object value) {
        if (value instanceof Number) {
            return toDouble(value);
        }
        if (!(value instanceof String text) || text.isBlank()) {
            return 0.0;
        }
        String val = text.trim().toLowerCase(Locale.ROOT);

        if (val.equals("yes") || val.equals("present")) return 1.0;
        if (val.equals("no") || val.equals("absent")) return 0.0;

        // severity
        if (val.contains("severe") || val.equals("high")) return 1.0;
        if (val.contains("moderate") || val.equals("medium")) return 0.6;
        if (val.contains("mild") || val.equals("low")) return 0.3;

        // duration
        if (val.contains("more than 12 weeks") || val.contains(">12")) return 1.0;
        if (val.contains("5-12") || val.contains("5 - 12")) return 0.7;
        if (val.contains("2-4") || val.contains("2 - 4")) return 0.4;
        if (val.contains("less than") || val.contains("<")) return 0.2;

        // treatment level, negated phrases first
        if (val.contains("non-invasive")) return 0.4;
        if (val.contains("invasive") || val.contains("surgical")) return 1.0;
        if (val.contains("passive")) return 0.3;
        if (val.contains("active")) return 0.6;

        // compliance
        if (val.contains("non-compliant")) return 0.2;
        if (val.contains("partial")) return 0.5;
        if (val.contains("compliant")) return 1.0;

        // emergency treatment
        if (val.contains("inpatient")) return 1.0;
        if (val.contains("outpatient")) return 0.6;
        if (val.contains("treated & released")) return 0.4;

        // location
        if (val.contains("bilateral")) return 1.0;
        if (val.contains("unilateral")) return 0.6;
        if (val.contains("multiple")) return 0.9;
        if (val.contains("single")) return 0.5;

        // timing
        if (val.contains("immediate") || val.contains("first 48")) return 1.0;
        if (val.contains("more than 7")) return 0.3;

        // mechanism
        if (val.contains("inconsistent")) return 0.2;
        if (val.contains("consistent")) return 1.0;

        OptionalDouble parsed = parseNumeric(val);
        return parsed.isPresent() ? Math.min(1.0, Math.max(0.0, parsed.getAsDouble())) : 0.0;
    }

    private static OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
