package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensitivityAnalysisResponse {

    private boolean success;

    private double perturbation;

    @JsonProperty("sensitivity_results")
    private Map<String, SensitivityResult> sensitivityResults;
}
