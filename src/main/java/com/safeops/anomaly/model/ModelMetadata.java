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
@Schema(description = "Resident model cache entry")
public class ModelMetadata {

    private String pipelineId;

    @Schema(description = "Seconds since the entry was trained", example = "42.7")
    private double ageSeconds;

    @Schema(description = "Historical rows the models were trained on", example = "480")
    private int trainingSamples;

    private int treeCount;

    private int featureOrderVersion;

    @Schema(description = "Whether an autoencoder was trained alongside the forest")
    private boolean reconstruction;
}
