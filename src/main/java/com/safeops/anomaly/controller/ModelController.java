package com.safeops.anomaly.controller;

import com.safeops.anomaly.cache.ModelCache;
import com.safeops.anomaly.model.ModelMetadata;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/models")
@Tag(name = "Models", description = "Inspect the per-pipeline model cache")
public class ModelController {

    private final ModelCache modelCache;

    public ModelController(ModelCache modelCache) {
        this.modelCache = modelCache;
    }

    @Operation(summary = "List resident models", description = "Most recently trained first.")
    @GetMapping
    public ResponseEntity<List<ModelMetadata>> listModels() {
        return ResponseEntity.ok(modelCache.snapshot());
    }

    @Operation(summary = "Get a pipeline's model metadata",
            description = "Age, training sample count, tree count and feature order version of the resident entry.")
    @GetMapping("/{pipelineId}")
    public ResponseEntity<ModelMetadata> getModel(
            @Parameter(description = "Pipeline ID", example = "payments-api")
            @PathVariable String pipelineId) {
        return modelCache.describe(pipelineId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
