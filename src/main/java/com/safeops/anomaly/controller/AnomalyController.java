package com.safeops.anomaly.controller;

import com.safeops.anomaly.model.AnomalyReport;
import com.safeops.anomaly.model.RunRecord;
import com.safeops.anomaly.model.TrainResult;
import com.safeops.anomaly.service.AnomalyDecisionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Anomaly", description = "Score pipeline runs and manage the per-pipeline model cache")
public class AnomalyController {

    private final AnomalyDecisionService decisionService;

    public AnomalyController(AnomalyDecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Operation(summary = "Score a pipeline run",
            description = "Appends the run to the pipeline's history, then scores it against that history. " +
                    "Pipelines with fewer than the minimum history are scored by the fallback rule; the rest by " +
                    "the cached Isolation Forest and, when enabled, the autoencoder.")
    @PostMapping("/anomaly")
    public ResponseEntity<?> detectAnomaly(@RequestBody RunRecord run) {
        if (run.getPipelineId() == null || run.getPipelineId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("detail", "pipeline_id is required"));
        }

        if (run.getTimestamp() == 0) {
            run.setTimestamp(System.currentTimeMillis());
        }

        AnomalyReport report = decisionService.evaluate(run);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Train or refresh a pipeline's models",
            description = "Runs the cache check for the pipeline without scoring a run: reuses fresh models, " +
                    "retrains stale ones, and reports whether the history is sufficient.")
    @PostMapping("/train")
    public ResponseEntity<TrainResult> train(
            @Parameter(description = "Pipeline ID", example = "payments-api/main")
            @RequestParam String pipelineId) {
        return ResponseEntity.ok(decisionService.train(pipelineId));
    }

    @Operation(summary = "Clear the model cache",
            description = "Drops every trained model; the next scoring request per pipeline retrains.")
    @PostMapping("/reset-cache")
    public ResponseEntity<Map<String, String>> resetCache() {
        decisionService.resetCache();
        return ResponseEntity.ok(Map.of("status", "cache cleared"));
    }
}
