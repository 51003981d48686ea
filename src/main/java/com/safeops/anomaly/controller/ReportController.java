package com.safeops.anomaly.controller;

import com.safeops.anomaly.model.AnomalyReport;
import com.safeops.anomaly.model.PipelineStats;
import com.safeops.anomaly.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Reports", description = "Query stored anomaly reports and counts")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @Operation(summary = "List recent anomaly reports",
            description = "Newest first. The limit is clamped to [1, 200].")
    @GetMapping("/reports")
    public ResponseEntity<List<AnomalyReport>> getReports(
            @Parameter(description = "Only reports of this pipeline")
            @RequestParam(name = "pipeline_id", required = false) String pipelineId,
            @Parameter(description = "Max number of reports to return", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(reportService.recentReports(pipelineId, limit));
    }

    @Operation(summary = "Run and anomaly counts",
            description = "Counts for one pipeline, or across all pipelines when pipeline_id is omitted.")
    @GetMapping("/stats")
    public ResponseEntity<PipelineStats> getStats(
            @Parameter(description = "Only count this pipeline")
            @RequestParam(name = "pipeline_id", required = false) String pipelineId) {
        return ResponseEntity.ok(reportService.stats(pipelineId));
    }
}
