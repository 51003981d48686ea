package com.safeops.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.safeops.anomaly.config.AerospikeConfig;
import com.safeops.anomaly.model.RunRecord;
import com.safeops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.invocation.Invocation;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunRecordRepositoryTest {

    @Mock private AerospikeClient client;

    private RunRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new RunRecordRepository(client, "test", new WritePolicy());
    }

    private static Record storedRun(String recordId, String pipelineId, long ts, double duration) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("recordId", recordId);
        bins.put("pipelineId", pipelineId);
        bins.put("ts", ts);
        bins.put("durationSec", duration);
        bins.put("errorCount", 1L);
        bins.put("secretsCount", 0L);
        bins.put("urlsCount", 3L);
        bins.put("bypassCount", 0L);
        bins.put("stepsCount", 8L);
        bins.put("severityScore", 20.0);
        return new Record(bins, 1, 0);
    }

    private void givenStored(Record... records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record record : records) {
                callback.scanCallback(new Key("test", AerospikeConfig.SET_PIPELINE_RUNS, "k"), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_PIPELINE_RUNS),
                any(ScanCallback.class), any(String[].class));
    }

    @Test
    void save_writesFeatureBinsAndReturnsKey() {
        RunRecord run = TestDataFactory.cleanRun("p1");
        run.setSecretsCount(null);

        String recordId = repository.save(run);

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        Map<String, Object> written = new HashMap<>();
        for (Bin bin : bins.getValue()) {
            written.put(bin.name, bin.value.getObject());
        }
        assertThat(recordId).isNotBlank();
        assertThat(written)
                .containsEntry("recordId", recordId)
                .containsEntry("pipelineId", "p1")
                .containsEntry("durationSec", 120.0)
                .containsEntry("secretsCount", 0.0)
                .containsEntry("errorCount", 1.0)
                .containsEntry("runId", "run-1");
    }

    @Test
    void findRecentFeatures_newestFirst_excludesCurrentRun_respectsLimit() {
        givenStored(
                storedRun("a", "p1", 1_000, 100),
                storedRun("b", "p1", 3_000, 300),
                storedRun("c", "p2", 4_000, 999),
                storedRun("d", "p1", 2_000, 200),
                storedRun("current", "p1", 5_000, 500));

        List<double[]> rows = repository.findRecentFeatures("p1", 2, "current");

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)[0]).isEqualTo(300.0);
        assertThat(rows.get(1)[0]).isEqualTo(200.0);
    }

    @Test
    void findRecentFeatures_unseenPipeline_isEmpty() {
        givenStored(storedRun("a", "p1", 1_000, 100));

        assertThat(repository.findRecentFeatures("unknown", 500, null)).isEmpty();
    }

    @Test
    void count_scopedAndGlobal() {
        givenStored(storedRun("a", "p1", 1, 1), storedRun("b", "p2", 2, 2), storedRun("c", "p1", 3, 3));

        assertThat(repository.count("p1")).isEqualTo(2);
        assertThat(repository.count(null)).isEqualTo(3);
    }

    @Test
    void findRecentFeatures_readsOnlyFeatureBins() {
        givenStored(storedRun("a", "p1", 1_000, 100));

        repository.findRecentFeatures("p1", 500, null);

        List<String> requested = new ArrayList<>();
        for (Invocation invocation : mockingDetails(client).getInvocations()) {
            if (!invocation.getMethod().getName().equals("scanAll")) continue;
            Object[] args = invocation.getArguments();
            for (int i = 4; i < args.length; i++) {
                if (args[i] instanceof String[]) {
                    requested.addAll(List.of((String[]) args[i]));
                } else {
                    requested.add((String) args[i]);
                }
            }
        }
        assertThat(requested)
                .contains("pipelineId", "ts", "durationSec", "severityScore")
                .doesNotContain("meta", "runId");
    }

    @Test
    void findRecentFeatures_keepsFractionalAndLegacyIntegerCounts() {
        Record fractional = storedRun("a", "p1", 2_000, 100);
        fractional.bins.put("errorCount", 2.7);
        givenStored(fractional, storedRun("b", "p1", 1_000, 100));

        List<double[]> rows = repository.findRecentFeatures("p1", 500, null);

        assertThat(rows.get(0)[1]).isEqualTo(2.7);
        assertThat(rows.get(1)[1]).isEqualTo(1.0);
        assertThat(rows.get(1)[5]).isEqualTo(8.0);
    }
}
