package com.claimlens.recalibration.model;

/**
 * Error metric an optimizer minimizes
 */
public enum TargetMetric {
    MAPE,
    RMSE,
    BOTH;

    /**
     * Divisor bringing RMSE (currency units) to roughly the scale of MAPE (percent) in the blended
     * objective. Fixed unit-matching constant, not a statistical parameter.
     */
    public static final double RMSE_BLEND_SCALE = 10000.0;

    public double score(double mape, double rmse) {
        return switch (this) {
            case MAPE -> mape;
            case RMSE -> rmse;
            case BOTH -> mape + rmse / RMSE_BLEND_SCALE;
        };
    }
}
