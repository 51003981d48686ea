package com.safeops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Verdict for one run record, with per-model detail for audit")
public class AnomalyReport {

    @Schema(description = "Scoring time in epoch milliseconds", example = "1760781600123")
    private long ts;

    @Schema(description = "Pipeline identifier", example = "payments-api/main")
    private String pipelineId;

    @Schema(description = "CI run identifier", example = "run-8812")
    private String runId;

    @Schema(description = "CI job identifier", example = "build")
    private String jobId;

    @Schema(description = "Scoring path that produced the verdict", example = "isolation+reconstruction")
    private ScoringMode mode;

    @Schema(description = "Model label", example = "isolation-forest+autoencoder")
    private String modelUsed;

    @Schema(description = "Combined anomaly score in [0, 1]", example = "0.42")
    private double anomalyScore;

    @JsonProperty("is_anomaly")
    @Schema(description = "Final verdict", example = "false")
    private boolean anomaly;

    @Schema(description = "Raw and normalised outputs of each model or rule that contributed")
    private Map<String, Object> details;
}
