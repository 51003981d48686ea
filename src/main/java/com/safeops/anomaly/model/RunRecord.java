package com.safeops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "One CI/CD pipeline execution submitted for anomaly scoring. Absent numeric fields count as 0.")
public class RunRecord {

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    @Schema(description = "Store key assigned when the run is appended to history", accessMode = Schema.AccessMode.READ_ONLY)
    private String recordId;

    @Schema(description = "Receive time in epoch milliseconds. Defaults to current time if not provided.", example = "1760781600000")
    private long timestamp;

    @Schema(description = "Pipeline identifier", example = "payments-api/main", requiredMode = Schema.RequiredMode.REQUIRED)
    private String pipelineId;

    @Schema(description = "CI run identifier", example = "run-8812")
    private String runId;

    @Schema(description = "CI job identifier", example = "build")
    private String jobId;

    @Schema(description = "Log source", example = "github-actions")
    private String source;

    @Schema(description = "Run status reported by CI", example = "success")
    private String status;

    @Schema(description = "Run duration in seconds", example = "124.5")
    private Double durationSec;

    @Schema(description = "Error lines found in the run log", example = "0")
    private Double errorCount;

    @Schema(description = "Secrets detected in the run log", example = "0")
    private Double secretsCount;

    @Schema(description = "URLs referenced in the run log", example = "3")
    private Double urlsCount;

    @Schema(description = "Attempts to bypass security checks", example = "0")
    private Double bypassCount;

    @Schema(description = "Number of executed steps", example = "8")
    private Double stepsCount;

    @Schema(description = "Severity score, 0-100 by convention", example = "20")
    private Double severityScore;

    @Schema(description = "Free-form metadata carried with the run")
    private Map<String, Object> meta;
}
