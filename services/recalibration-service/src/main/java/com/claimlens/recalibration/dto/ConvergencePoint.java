package com.claimlens.recalibration.dto;

import com.claimlens.recalibration.model.ConvergenceStep;
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
public class ConvergencePoint {

    private int iteration;
    private double mape;
    private double rmse;

    @JsonProperty("weight_deltas")
    private Map<String, Double> weightDeltas;

    public static ConvergencePoint from(ConvergenceStep step) {
        return ConvergencePoint.builder()
                .iteration(step.getIteration())
                .mape(step.getMape())
                .rmse(step.getRmse())
                .weightDeltas(step.getWeightDeltas())
                .build();
    }
}
