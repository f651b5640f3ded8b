package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecalibrationMetrics {

    int totalClaims;
    int improvedCount;
    int degradedCount;
    int unchangedCount;
    double avgImprovementPct;
    double mapeBefore;
    double mapeAfter;
    double rmseBefore;
    double rmseAfter;
}
