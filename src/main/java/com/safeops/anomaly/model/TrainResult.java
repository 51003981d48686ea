package com.safeops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Outcome of an explicit cache check/train request")
public class TrainResult {

    private String pipelineId;

    private int historyCount;

    private int minHistory;

    @Schema(description = "Whether history reaches the minimum needed to train")
    private boolean sufficient;

    @Schema(description = "Whether models are resident for the pipeline after the call")
    private boolean trained;

    @Schema(description = "Whether an existing fresh entry was reused instead of retraining")
    private boolean reused;
}
