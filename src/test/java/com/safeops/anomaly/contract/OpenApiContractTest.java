package com.safeops.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.safeops.anomaly.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so that endpoint paths and wire field names
 * do not drift unnoticed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        assertThat(paths).containsKeys(
                "/", "/anomaly", "/train", "/reset-cache",
                "/reports", "/stats", "/health",
                "/models", "/models/{pipelineId}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKeys("RunRecord", "AnomalyReport", "PipelineStats",
                "TrainResult", "HealthStatus", "ModelMetadata");
    }

    @Test
    void openApiSpec_usesSnakeCaseFieldNames() {
        DocumentContext json = apiDocs();

        Map<String, Object> runProps = json.read("$.components.schemas.RunRecord.properties");
        assertThat(runProps).containsKeys("pipeline_id", "run_id", "job_id", "duration_sec",
                "error_count", "secrets_count", "urls_count", "bypass_count", "steps_count", "severity_score");

        Map<String, Object> reportProps = json.read("$.components.schemas.AnomalyReport.properties");
        assertThat(reportProps).containsKeys("pipeline_id", "mode", "model_used", "anomaly_score",
                "is_anomaly", "details");
    }

    @Test
    void health_reportsStoreDownWithMockClient() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("store", "down")
                .containsEntry("status", "degraded");
    }

    @Test
    void anomaly_emptyStore_scoresOnFallbackRule() {
        Map<String, Object> run = Map.of("pipeline_id", "contract-p1", "duration_sec", 12.5, "error_count", 0);

        ResponseEntity<Map> response = restTemplate.postForEntity("/anomaly", run, Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("pipeline_id", "contract-p1")
                .containsEntry("mode", "fallback")
                .containsEntry("model_used", "rule-fallback")
                .containsEntry("is_anomaly", false);
    }
}
