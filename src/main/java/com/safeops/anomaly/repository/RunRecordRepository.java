package com.safeops.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safeops.anomaly.config.AerospikeConfig;
import com.safeops.anomaly.engine.FeatureVectorizer;
import com.safeops.anomaly.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only history of pipeline runs. Each write is a single put, visible immediately.
 */
@Repository
public class RunRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(RunRecordRepository.class);

    private static final String[] FEATURE_BINS = {
            "pipelineId", "recordId", "ts",
            "durationSec", "errorCount", "secretsCount", "urlsCount", "bypassCount", "stepsCount", "severityScore"
    };

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public RunRecordRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Append a run and return the key it was stored under.
     */
    public String save(RunRecord record) {
        String recordId = UUID.randomUUID().toString();
        Key key = new Key(namespace, AerospikeConfig.SET_PIPELINE_RUNS, recordId);
        double[] features = FeatureVectorizer.vectorize(record);

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("recordId", recordId),
                new Bin("pipelineId", record.getPipelineId()),
                new Bin("ts", record.getTimestamp()),
                new Bin("durationSec", features[FeatureVectorizer.DURATION]),
                new Bin("errorCount", features[FeatureVectorizer.ERRORS]),
                new Bin("secretsCount", features[FeatureVectorizer.SECRETS]),
                new Bin("urlsCount", features[FeatureVectorizer.URLS]),
                new Bin("bypassCount", features[FeatureVectorizer.BYPASS]),
                new Bin("stepsCount", features[FeatureVectorizer.STEPS]),
                new Bin("severityScore", features[FeatureVectorizer.SEVERITY])));

        if (record.getRunId() != null) bins.add(new Bin("runId", record.getRunId()));
        if (record.getJobId() != null) bins.add(new Bin("jobId", record.getJobId()));
        if (record.getSource() != null) bins.add(new Bin("source", record.getSource()));
        if (record.getStatus() != null) bins.add(new Bin("status", record.getStatus()));
        if (record.getMeta() != null && !record.getMeta().isEmpty()) {
            bins.add(new Bin("meta", toJson(record.getMeta())));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
        log.debug("Stored run {} for pipeline={} (run={})", recordId, record.getPipelineId(), record.getRunId());
        return recordId;
    }

    /**
     * Feature rows of the pipeline's most recent runs, newest first, at most {@code limit}.
     * Empty for an unseen pipeline.
     *
     * @param excludeRecordId run to leave out (the one being scored), or null
     */
    public List<double[]> findRecentFeatures(String pipelineId, int limit, String excludeRecordId) {
        List<TimedFeatures> runs = scanPipeline(pipelineId, excludeRecordId);
        runs.sort(Comparator.comparingLong(TimedFeatures::timestamp).reversed());

        List<double[]> rows = new ArrayList<>(Math.min(limit, runs.size()));
        for (TimedFeatures run : runs) {
            if (rows.size() >= limit) break;
            rows.add(run.features());
        }
        return rows;
    }

    /**
     * Runs stored for a pipeline, or across all pipelines when {@code pipelineId} is null.
     */
    public long count(String pipelineId) {
        AtomicLong count = new AtomicLong();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_PIPELINE_RUNS,
                (key, record) -> {
                    if (pipelineId == null || pipelineId.equals(record.getString("pipelineId"))) {
                        count.incrementAndGet();
                    }
                }, "pipelineId");
        return count.get();
    }

    private List<TimedFeatures> scanPipeline(String pipelineId, String excludeRecordId) {
        List<TimedFeatures> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_PIPELINE_RUNS,
                (key, record) -> {
                    if (!pipelineId.equals(record.getString("pipelineId"))) return;
                    if (excludeRecordId != null && excludeRecordId.equals(record.getString("recordId"))) return;
                    TimedFeatures run = new TimedFeatures(record.getLong("ts"), toFeatures(record));
                    synchronized (results) {
                        results.add(run);
                    }
                }, FEATURE_BINS);
        return results;
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private static double[] toFeatures(Record record) {
        double[] features = new double[FeatureVectorizer.FEATURE_COUNT];
        features[FeatureVectorizer.DURATION] = number(record, "durationSec");
        features[FeatureVectorizer.ERRORS] = number(record, "errorCount");
        features[FeatureVectorizer.SECRETS] = number(record, "secretsCount");
        features[FeatureVectorizer.URLS] = number(record, "urlsCount");
        features[FeatureVectorizer.BYPASS] = number(record, "bypassCount");
        features[FeatureVectorizer.STEPS] = number(record, "stepsCount");
        features[FeatureVectorizer.SEVERITY] = number(record, "severityScore");
        return features;
    }

    // Counts written before they became doubles are stored as integers.
    private static double number(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    private String toJson(Map<String, Object> meta) {
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize run metadata", e);
        }
    }

    private record TimedFeatures(long timestamp, double[] features) {}
}
