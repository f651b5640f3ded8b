package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for a recalibration: metrics of the supplied weights
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecalibrationResponse {

    private boolean success;
    private PerformanceMetrics metrics;

    @JsonProperty("optimized_weights")
    private Map<String, Double> optimizedWeights;

    private String message;
}
