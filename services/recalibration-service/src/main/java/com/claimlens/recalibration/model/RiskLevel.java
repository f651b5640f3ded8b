package com.claimlens.recalibration.model;

/**
 * Four-tier classification of a claim's absolute prediction deviation.
 * Lower bounds are exclusive: exactly 30% is HIGH, not CRITICAL.
 */
public enum RiskLevel {
    CRITICAL("Critical"),
    HIGH("High Risk"),
    MEDIUM("Medium Risk"),
    LOW("Low Risk");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RiskLevel classify(double deviationPct) {
        double absolute = Math.abs(deviationPct);
        if (absolute > 30.0) {
            return CRITICAL;
        }
        if (absolute > 20.0) {
            return HIGH;
        }
        if (absolute > 10.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
