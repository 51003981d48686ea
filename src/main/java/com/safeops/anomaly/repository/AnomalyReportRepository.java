package com.safeops.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safeops.anomaly.config.AerospikeConfig;
import com.safeops.anomaly.model.AnomalyReport;
import com.safeops.anomaly.model.ScoringMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class AnomalyReportRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AnomalyReportRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Append a report. A details payload that cannot be serialised fails the write.
     */
    public void save(AnomalyReport report) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_REPORTS, UUID.randomUUID().toString());

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("ts", report.getTs()),
                new Bin("pipelineId", report.getPipelineId()),
                new Bin("mode", report.getMode().getLabel()),
                new Bin("modelUsed", report.getModelUsed()),
                new Bin("anomalyScore", report.getAnomalyScore()),
                new Bin("isAnomaly", report.isAnomaly()),
                new Bin("details", serializeDetails(report.getDetails()))));
        if (report.getRunId() != null) bins.add(new Bin("runId", report.getRunId()));
        if (report.getJobId() != null) bins.add(new Bin("jobId", report.getJobId()));

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    /**
     * Newest reports first, for one pipeline or all when {@code pipelineId} is null.
     */
    public List<AnomalyReport> findRecent(String pipelineId, int limit) {
        List<AnomalyReport> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALY_REPORTS,
                (key, record) -> {
                    if (pipelineId != null && !pipelineId.equals(record.getString("pipelineId"))) return;
                    AnomalyReport report = mapRecord(record);
                    synchronized (results) {
                        results.add(report);
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyReport::getTs).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    /**
     * Reports with a positive verdict, for one pipeline or all when {@code pipelineId} is null.
     */
    public long countAnomalies(String pipelineId) {
        AtomicLong count = new AtomicLong();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALY_REPORTS,
                (key, record) -> {
                    if (pipelineId != null && !pipelineId.equals(record.getString("pipelineId"))) return;
                    if (record.getBoolean("isAnomaly")) {
                        count.incrementAndGet();
                    }
                });
        return count.get();
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private AnomalyReport mapRecord(Record record) {
        return AnomalyReport.builder()
                .ts(record.getLong("ts"))
                .pipelineId(record.getString("pipelineId"))
                .runId(record.getString("runId"))
                .jobId(record.getString("jobId"))
                .mode(ScoringMode.fromLabel(record.getString("mode")))
                .modelUsed(record.getString("modelUsed"))
                .anomalyScore(record.getDouble("anomalyScore"))
                .anomaly(record.getBoolean("isAnomaly"))
                .details(deserializeDetails(record.getString("details")))
                .build();
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details == null ? Collections.emptyMap() : details);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize anomaly report details", e);
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize anomaly report details", e);
            return Collections.emptyMap();
        }
    }
}
