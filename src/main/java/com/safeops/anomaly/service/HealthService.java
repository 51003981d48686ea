package com.safeops.anomaly.service;

import com.aerospike.client.AerospikeClient;
import com.safeops.anomaly.cache.ModelCache;
import com.safeops.anomaly.engine.FeatureVectorizer;
import com.safeops.anomaly.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Liveness view. An unreachable store degrades the status; it never fails the call.
 */
@Service
public class HealthService {

    private static final Logger log = LoggerFactory.getLogger(HealthService.class);

    private final AerospikeClient client;
    private final ModelCache modelCache;

    public HealthService(AerospikeClient client, ModelCache modelCache) {
        this.client = client;
        this.modelCache = modelCache;
    }

    public HealthStatus health() {
        boolean storeUp = isStoreReachable();
        if (!storeUp) {
            log.warn("Health check: Aerospike cluster is not reachable");
        }
        return HealthStatus.builder()
                .status(storeUp ? "ok" : "degraded")
                .store(storeUp ? "up" : "down")
                .cacheSize(modelCache.size())
                .reconstructionEnabled(modelCache.isReconstructionEnabled())
                .featureOrderVersion(FeatureVectorizer.FEATURE_ORDER_VERSION)
                .build();
    }

    private boolean isStoreReachable() {
        try {
            return client.isConnected();
        } catch (RuntimeException e) {
            log.warn("Health check: store check failed: {}", e.getMessage());
            return false;
        }
    }
}
