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
public class HealthStatus {

    @Schema(description = "ok when the store is reachable, degraded otherwise", example = "ok")
    private String status;

    @Schema(description = "Store reachability", example = "up", allowableValues = {"up", "down"})
    private String store;

    private int cacheSize;

    private boolean reconstructionEnabled;

    private int featureOrderVersion;
}
