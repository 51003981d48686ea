package com.safeops.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    // Expected share of anomalous runs in a pipeline's history.
    private double contamination = 0.05;

    // Below this many historical runs a pipeline is scored by the fallback rule.
    private int minHistory = 10;

    // Most recent runs fetched as training data.
    private int historyLimit = 500;

    private Isolation isolation = new Isolation();

    private Reconstruction reconstruction = new Reconstruction();

    private Cache cache = new Cache();

    private Training training = new Training();

    private Decision decision = new Decision();

    private Fallback fallback = new Fallback();

    @Data
    public static class Isolation {
        private int numTrees = 200;
        private int maxSamples = 256;
        private long seed = 42L;
    }

    @Data
    public static class Reconstruction {
        private boolean enabled = true;
        private int epochs = 10;
        private int batchSize = 16;
        private double learningRate = 0.001;
        // Historical points used to derive the error threshold.
        private int thresholdSampleSize = 200;
        private double thresholdPercentile = 90.0;
        private long seed = 42L;
    }

    @Data
    public static class Cache {
        private long ttlSeconds = 300;
        private int maxPipelines = 50;
    }

    @Data
    public static class Training {
        private int poolSize = 2;
        private int queueCapacity = 64;
        private long timeoutSeconds = 60;
    }

    @Data
    public static class Decision {
        private double isolationWeight = 0.6;
        private double reconstructionWeight = 0.4;
        private double combinedThreshold = 0.7;
    }

    @Data
    public static class Fallback {
        private int errorCount = 3;
        private double severityScore = 80.0;
        private double durationSec = 600.0;
    }
}
