package com.safeops.anomaly.service;

import com.safeops.anomaly.cache.CacheLookup;
import com.safeops.anomaly.cache.ModelCache;
import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.config.MetricsConfig;
import com.safeops.anomaly.engine.FallbackRule;
import com.safeops.anomaly.engine.FeatureVectorizer;
import com.safeops.anomaly.engine.IsolationEstimator;
import com.safeops.anomaly.engine.ReconstructionEstimator;
import com.safeops.anomaly.model.AnomalyReport;
import com.safeops.anomaly.model.RunRecord;
import com.safeops.anomaly.model.ScoringMode;
import com.safeops.anomaly.model.TrainResult;
import com.safeops.anomaly.repository.AnomalyReportRepository;
import com.safeops.anomaly.repository.RunRecordRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main orchestrator for run scoring.
 *
 * Flow:
 * 1. Append the run to the pipeline's history (kept even if scoring later fails)
 * 2. Fetch the pipeline's recent history, excluding the run just stored
 * 3. Fewer than min-history rows: fallback rule, the model cache is not touched
 * 4. Otherwise: fresh or retrained models from the cache, isolation score, reconstruction
 *    score when that backend is present, fused by {@link ScoreCombiner}
 * 5. Persist and return the anomaly report
 *
 * Nothing is retried. Any exception aborts the request after step 1.
 */
@Service
public class AnomalyDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDecisionService.class);

    private final RunRecordRepository runRecordRepository;
    private final AnomalyReportRepository reportRepository;
    private final ModelCache modelCache;
    private final IsolationEstimator isolationEstimator;
    private final Optional<ReconstructionEstimator> reconstructionEstimator;
    private final FallbackRule fallbackRule;
    private final ScoreCombiner scoreCombiner;
    private final DetectorProperties properties;
    private final MetricsConfig metricsConfig;

    public AnomalyDecisionService(RunRecordRepository runRecordRepository,
                                  AnomalyReportRepository reportRepository,
                                  ModelCache modelCache,
                                  IsolationEstimator isolationEstimator,
                                  Optional<ReconstructionEstimator> reconstructionEstimator,
                                  FallbackRule fallbackRule,
                                  ScoreCombiner scoreCombiner,
                                  DetectorProperties properties,
                                  MetricsConfig metricsConfig) {
        this.runRecordRepository = runRecordRepository;
        this.reportRepository = reportRepository;
        this.modelCache = modelCache;
        this.isolationEstimator = isolationEstimator;
        this.reconstructionEstimator = reconstructionEstimator;
        this.fallbackRule = fallbackRule;
        this.scoreCombiner = scoreCombiner;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "anomaly.evaluate", contextualName = "evaluate-run")
    public AnomalyReport evaluate(RunRecord run) {
        String recordId = runRecordRepository.save(run);

        double[] features = FeatureVectorizer.vectorize(run);
        List<double[]> rows = runRecordRepository.findRecentFeatures(
                run.getPipelineId(), properties.getHistoryLimit(), recordId);

        AnomalyReport report;
        if (rows.size() < properties.getMinHistory()) {
            log.debug("Pipeline {} has {} historical runs (min {}). Using fallback rule.",
                    run.getPipelineId(), rows.size(), properties.getMinHistory());
            report = scoreWithFallback(run, features, rows.size());
        } else {
            report = scoreWithModels(run, features, rows.toArray(new double[0][]));
        }

        reportRepository.save(report);
        metricsConfig.recordEvaluation(report.getMode().getLabel(), report.isAnomaly());

        if (report.isAnomaly()) {
            log.warn("Anomaly detected for pipeline={}, run={}, job={}: score={}, mode={}",
                    run.getPipelineId(), run.getRunId(), run.getJobId(),
                    report.getAnomalyScore(), report.getMode().getLabel());
        }
        return report;
    }

    /**
     * Check the pipeline's cache entry and train it if stale, without scoring a run.
     */
    public TrainResult train(String pipelineId) {
        List<double[]> rows = runRecordRepository.findRecentFeatures(
                pipelineId, properties.getHistoryLimit(), null);

        TrainResult.TrainResultBuilder result = TrainResult.builder()
                .pipelineId(pipelineId)
                .historyCount(rows.size())
                .minHistory(properties.getMinHistory());

        if (rows.size() < properties.getMinHistory()) {
            log.info("Not training pipeline {}: {} historical runs, {} required",
                    pipelineId, rows.size(), properties.getMinHistory());
            return result.sufficient(false).trained(false).reused(false).build();
        }

        CacheLookup lookup = modelCache.getOrTrain(pipelineId, rows.toArray(new double[0][]));
        return result.sufficient(true).trained(true).reused(lookup.reused()).build();
    }

    public void resetCache() {
        modelCache.reset();
    }

    private AnomalyReport scoreWithFallback(RunRecord run, double[] features, int historyCount) {
        FallbackRule.Result result = fallbackRule.evaluate(features);

        Map<String, Object> details = baseDetails(features, historyCount);
        details.put("reason", "insufficient_history");
        details.put("rules", Map.of(
                "triggered", result.triggeredConditions(),
                "score", result.score(),
                "is_anomaly", result.anomaly()));

        return buildReport(run, ScoringMode.FALLBACK, result.score(), result.anomaly(), details);
    }

    private AnomalyReport scoreWithModels(RunRecord run, double[] features, double[][] history) {
        CacheLookup lookup = modelCache.getOrTrain(run.getPipelineId(), history);

        IsolationEstimator.Outcome isolation = isolationEstimator.evaluate(lookup.models().isolation(), features);
        Optional<ReconstructionEstimator.Outcome> reconstruction = reconstructionEstimator.flatMap(estimator ->
                lookup.models().reconstructionModel()
                        .map(model -> estimator.evaluate(model, features, history)));

        ScoreCombiner.Combined combined = reconstruction
                .map(outcome -> scoreCombiner.combine(isolation, outcome))
                .orElseGet(() -> scoreCombiner.combine(isolation));
        ScoringMode mode = reconstruction.isPresent()
                ? ScoringMode.ISOLATION_RECONSTRUCTION
                : ScoringMode.ISOLATION_ONLY;

        Map<String, Object> details = baseDetails(features, history.length);
        details.put("cache_reused", lookup.reused());
        details.put("feature_order_version", lookup.models().featureOrderVersion());
        details.put("isolation", isolation.toDetails());
        details.put("reconstruction", reconstruction
                .<Object>map(ReconstructionEstimator.Outcome::toDetails)
                .orElse(Map.of("enabled", false)));
        details.put("combined", Map.of(
                "score", combined.score(),
                "threshold", properties.getDecision().getCombinedThreshold()));

        return buildReport(run, mode, combined.score(), combined.anomaly(), details);
    }

    private Map<String, Object> baseDetails(double[] features, int historyCount) {
        Map<String, Object> featureMap = new LinkedHashMap<>();
        for (int i = 0; i < FeatureVectorizer.FEATURE_COUNT; i++) {
            featureMap.put(FeatureVectorizer.FEATURE_NAMES[i], features[i]);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("history_count", historyCount);
        details.put("min_history", properties.getMinHistory());
        details.put("features", featureMap);
        return details;
    }

    private AnomalyReport buildReport(RunRecord run, ScoringMode mode, double score,
                                      boolean anomaly, Map<String, Object> details) {
        return AnomalyReport.builder()
                .ts(System.currentTimeMillis())
                .pipelineId(run.getPipelineId())
                .runId(run.getRunId())
                .jobId(run.getJobId())
                .mode(mode)
                .modelUsed(mode.getModelUsed())
                .anomalyScore(score)
                .anomaly(anomaly)
                .details(details)
                .build();
    }
}
