package com.safeops.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI pipelineAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pipeline Anomaly Detector API")
                        .version("1.0.0")
                        .description(
                                "Per-pipeline anomaly scoring for CI/CD run records.\n\n" +
                                "**Scoring flow:**\n" +
                                "1. Receive a run record via `POST /anomaly` and append it to the pipeline's history\n" +
                                "2. Fetch the pipeline's most recent runs (up to 500)\n" +
                                "3. Fewer than 10 runs: deterministic fallback rule (secrets, bypass attempts, " +
                                "errors >= 3, severity >= 80, duration >= 600s)\n" +
                                "4. Otherwise: cached per-pipeline Isolation Forest plus autoencoder, " +
                                "retrained when older than the cache TTL\n" +
                                "5. Combined score = 0.6 x isolation + 0.4 x reconstruction, anomalous when either model " +
                                "flags the run or the combined score exceeds 0.7\n" +
                                "6. Persist the anomaly report\n\n" +
                                "**Modes:** `fallback`, `isolation-only`, `isolation+reconstruction`")
                        .contact(new Contact().name("SafeOps Platform Team")));
    }
}
