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
@Schema(description = "Run and anomaly counts, for one pipeline or across all pipelines")
public class PipelineStats {

    @Schema(description = "Pipeline identifier, null when the counts are global", example = "payments-api/main")
    private String pipelineId;

    @Schema(description = "Run records in history", example = "412")
    private long runs;

    @Schema(description = "Reports with a positive verdict", example = "7")
    private long anomalies;
}
