package com.claimlens.recalibration.model;

public enum ClaimOutcome {
    IMPROVED,
    DEGRADED,
    UNCHANGED
}
