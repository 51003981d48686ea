package com.safeops.anomaly.service;

import com.safeops.anomaly.model.AnomalyReport;
import com.safeops.anomaly.model.PipelineStats;
import com.safeops.anomaly.repository.AnomalyReportRepository;
import com.safeops.anomaly.repository.RunRecordRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ReportService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 200;

    private final AnomalyReportRepository reportRepository;
    private final RunRecordRepository runRecordRepository;

    public ReportService(AnomalyReportRepository reportRepository, RunRecordRepository runRecordRepository) {
        this.reportRepository = reportRepository;
        this.runRecordRepository = runRecordRepository;
    }

    /**
     * Newest reports first; {@code limit} is clamped to [1, 200].
     */
    public List<AnomalyReport> recentReports(String pipelineId, int limit) {
        int bounded = Math.max(1, Math.min(MAX_LIMIT, limit));
        return reportRepository.findRecent(blankToNull(pipelineId), bounded);
    }

    public PipelineStats stats(String pipelineId) {
        String scope = blankToNull(pipelineId);
        return PipelineStats.builder()
                .pipelineId(scope)
                .runs(runRecordRepository.count(scope))
                .anomalies(reportRepository.countAnomalies(scope))
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
