package com.safeops.anomaly.controller;

import com.safeops.anomaly.model.HealthStatus;
import com.safeops.anomaly.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Health", description = "Liveness and dependency status")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @Operation(summary = "Service banner")
    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "AnomalyDetector is running"));
    }

    @Operation(summary = "Health status",
            description = "Store reachability, resident model count and whether the reconstruction backend is enabled. " +
                    "Always 200; an unreachable store reports status=degraded.")
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(healthService.health());
    }
}
