package com.safeops.anomaly.service;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.safeops.anomaly.cache.ModelCache;
import com.safeops.anomaly.engine.FeatureVectorizer;
import com.safeops.anomaly.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthServiceTest {

    @Mock private AerospikeClient client;
    @Mock private ModelCache modelCache;

    private HealthService healthService;

    @BeforeEach
    void setUp() {
        healthService = new HealthService(client, modelCache);
        when(modelCache.size()).thenReturn(3);
        when(modelCache.isReconstructionEnabled()).thenReturn(true);
    }

    @Test
    void connectedStore_isOk() {
        when(client.isConnected()).thenReturn(true);

        HealthStatus status = healthService.health();

        assertThat(status.getStatus()).isEqualTo("ok");
        assertThat(status.getStore()).isEqualTo("up");
        assertThat(status.getCacheSize()).isEqualTo(3);
        assertThat(status.isReconstructionEnabled()).isTrue();
        assertThat(status.getFeatureOrderVersion()).isEqualTo(FeatureVectorizer.FEATURE_ORDER_VERSION);
    }

    @Test
    void disconnectedStore_isDegraded() {
        when(client.isConnected()).thenReturn(false);

        HealthStatus status = healthService.health();

        assertThat(status.getStatus()).isEqualTo("degraded");
        assertThat(status.getStore()).isEqualTo("down");
    }

    @Test
    void storeCheckFailure_isDegradedNotThrown() {
        when(client.isConnected()).thenThrow(new AerospikeException("cluster gone"));

        assertThat(healthService.health().getStore()).isEqualTo("down");
    }
}
