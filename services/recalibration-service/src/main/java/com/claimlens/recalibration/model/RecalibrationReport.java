package com.claimlens.recalibration.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecalibrationReport {

    RecalibrationMetrics metrics;
    List<ClaimRecalibration> claims;
    EvaluationMetrics baselineEvaluation;
    EvaluationMetrics candidateEvaluation;
}
