package com.claimlens.recalibration.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Coefficients of the settlement exponent
 * {@code E = C0 + C1*S + C2*I + C3*S*I + C4*I^2 + C5*I^3 + C6*S^2}.
 *
 * <p>Independent of the per-factor weight table. Bound from configuration, so it keeps a
 * no-arg constructor with the production defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoringCoefficients {

    private double c0 = 10.5;     // base constant
    private double c1 = 0.15;     // severity
    private double c2 = 0.25;     // impact
    private double c3 = 0.05;     // severity x impact
    private double c4 = -0.1;     // impact^2
    private double c5 = 0.02;     // impact^3
    private double c6 = -0.01;    // severity^2

    public static ScoringCoefficients defaults() {
        return new ScoringCoefficients();
    }
}
