package com.safeops.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvaluation(String mode, boolean anomaly) {
        Counter.builder("anomaly.evaluation.count")
                .tag("mode", mode)
                .tag("verdict", anomaly ? "anomaly" : "normal")
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("model.cache.lookup")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordEviction(String reason, int count) {
        if (count <= 0) return;
        Counter.builder("model.cache.eviction")
                .tag("reason", reason)
                .register(registry)
                .increment(count);
    }

    public void recordTraining(long durationNanos, boolean reconstruction) {
        Timer.builder("model.training.duration")
                .tag("reconstruction", String.valueOf(reconstruction))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
