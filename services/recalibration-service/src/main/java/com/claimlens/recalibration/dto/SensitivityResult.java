package com.claimlens.recalibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MAE of one factor perturbed up and down, others at baseline.
 * {@code sensitivity_score = |increased - decreased| / base}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensitivityResult {

    @JsonProperty("base_mae")
    private double baseMae;

    @JsonProperty("increased_mae")
    private double increasedMae;

    @JsonProperty("decreased_mae")
    private double decreasedMae;

    @JsonProperty("sensitivity_score")
    private double sensitivityScore;
}
