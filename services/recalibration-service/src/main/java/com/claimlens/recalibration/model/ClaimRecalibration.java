package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

/**
 * Baseline vs. candidate comparison for a single claim
 */
@Value
@Builder
public class ClaimRecalibration {

    String claimId;
    double actualSettlement;
    double baselinePrediction;
    double candidatePrediction;

    /** Absolute error %, or {@code null} when the actual settlement is zero */
    Double baselineErrorPct;
    Double candidateErrorPct;

    /** Baseline minus candidate error, in percentage points */
    double improvementPct;

    ClaimOutcome outcome;
    RiskLevel baselineRisk;
    RiskLevel candidateRisk;
}
