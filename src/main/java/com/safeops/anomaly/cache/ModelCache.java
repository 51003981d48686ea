package com.safeops.anomaly.cache;

import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.config.MetricsConfig;
import com.safeops.anomaly.config.TrainingExecutorConfig;
import com.safeops.anomaly.engine.FeatureVectorizer;
import com.safeops.anomaly.engine.IsolationEstimator;
import com.safeops.anomaly.engine.ReconstructionEstimator;
import com.safeops.anomaly.model.ModelMetadata;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Per-pipeline cache of trained models.
 *
 * <ul>
 *   <li>An entry is fresh while its age is at most the TTL and it was trained against the current
 *       feature order; anything else is retrained on the next lookup.</li>
 *   <li>Lookups for the same pipeline are serialised by a per-pipeline lock, so a stale entry is
 *       retrained once however many requests arrive together. Different pipelines train in
 *       parallel.</li>
 *   <li>Training runs on the bounded training pool; the waiting request gives up after the
 *       training timeout, which also counts time spent queued. A training that outlives its
 *       request stays registered and the next lookup for the pipeline joins it instead of starting
 *       another. A saturated pool rejects the training outright.</li>
 *   <li>Every access first drops expired entries, then evicts the oldest-trained entries until
 *       at most {@code max-pipelines} remain.</li>
 * </ul>
 */
@Component
public class ModelCache {

    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private final IsolationEstimator isolationEstimator;
    private final Optional<ReconstructionEstimator> reconstructionEstimator;
    private final AsyncTaskExecutor trainingExecutor;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final LongSupplier clock;

    private final long ttlNanos;
    private final int maxPipelines;
    private final long trainingTimeoutSeconds;

    private final Map<String, CachedModels> entries = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> pipelineLocks = new ConcurrentHashMap<>();
    private final Map<String, Future<CachedModels>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public ModelCache(DetectorProperties properties,
                      IsolationEstimator isolationEstimator,
                      Optional<ReconstructionEstimator> reconstructionEstimator,
                      @Qualifier(TrainingExecutorConfig.TRAINING_EXECUTOR) AsyncTaskExecutor trainingExecutor,
                      MetricsConfig metricsConfig,
                      Tracer tracer) {
        this(properties, isolationEstimator, reconstructionEstimator, trainingExecutor, metricsConfig, tracer,
                System::nanoTime);
    }

    public ModelCache(DetectorProperties properties,
                      IsolationEstimator isolationEstimator,
                      Optional<ReconstructionEstimator> reconstructionEstimator,
                      AsyncTaskExecutor trainingExecutor,
                      MetricsConfig metricsConfig,
                      Tracer tracer,
                      LongSupplier clock) {
        this.isolationEstimator = isolationEstimator;
        this.reconstructionEstimator = reconstructionEstimator;
        this.trainingExecutor = trainingExecutor;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
        this.ttlNanos = TimeUnit.SECONDS.toNanos(properties.getCache().getTtlSeconds());
        this.maxPipelines = properties.getCache().getMaxPipelines();
        this.trainingTimeoutSeconds = properties.getTraining().getTimeoutSeconds();
    }

    /**
     * Return the pipeline's fresh models, or train on {@code history}, install and return new ones.
     *
     * @throws ModelTrainingException if training fails or exceeds the training timeout
     */
    public CacheLookup getOrTrain(String pipelineId, double[][] history) {
        garbageCollect();

        ReentrantLock lock = pipelineLocks.computeIfAbsent(pipelineId, id -> new ReentrantLock());
        lock.lock();
        try {
            CachedModels existing = entries.get(pipelineId);
            if (existing != null && isFresh(existing, clock.getAsLong())) {
                metricsConfig.recordCacheLookup(true);
                log.debug("Reusing models for pipeline={} (age={}s)",
                        pipelineId, ageSeconds(existing, clock.getAsLong()));
                return new CacheLookup(existing, true);
            }

            metricsConfig.recordCacheLookup(false);
            CachedModels trained = trainOnWorker(pipelineId, history);
            if (!isFresh(trained, clock.getAsLong())) {
                // joined a training that finished too long ago
                trained = trainOnWorker(pipelineId, history);
            }
            entries.put(pipelineId, trained);
            garbageCollect();
            return new CacheLookup(trained, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop expired entries, then evict oldest-trained entries while above capacity.
     */
    public synchronized void garbageCollect() {
        long now = clock.getAsLong();

        int expired = 0;
        Iterator<CachedModels> it = entries.values().iterator();
        while (it.hasNext()) {
            if (!isFresh(it.next(), now)) {
                it.remove();
                expired++;
            }
        }

        int evicted = 0;
        if (entries.size() > maxPipelines) {
            List<CachedModels> byAge = new ArrayList<>(entries.values());
            byAge.sort(Comparator.comparingLong(CachedModels::trainedAtNanos));
            int excess = entries.size() - maxPipelines;
            for (int i = 0; i < excess; i++) {
                entries.remove(byAge.get(i).pipelineId(), byAge.get(i));
                evicted++;
            }
        }

        if (expired > 0 || evicted > 0) {
            log.info("Model cache GC: expired={}, evicted={}, resident={}", expired, evicted, entries.size());
        }
        metricsConfig.recordEviction("ttl", expired);
        metricsConfig.recordEviction("capacity", evicted);
    }

    public synchronized void reset() {
        int cleared = entries.size();
        entries.clear();
        inFlight.clear();
        metricsConfig.recordEviction("reset", cleared);
        log.info("Model cache reset, {} entries cleared", cleared);
    }

    public int size() {
        return entries.size();
    }

    public boolean isReconstructionEnabled() {
        return reconstructionEstimator.isPresent();
    }

    public Optional<ModelMetadata> describe(String pipelineId) {
        CachedModels models = entries.get(pipelineId);
        return models == null ? Optional.empty() : Optional.of(toMetadata(models, clock.getAsLong()));
    }

    public List<ModelMetadata> snapshot() {
        long now = clock.getAsLong();
        return entries.values().stream()
                .sorted(Comparator.comparingLong(CachedModels::trainedAtNanos).reversed())
                .map(models -> toMetadata(models, now))
                .toList();
    }

    private CachedModels trainOnWorker(String pipelineId, double[][] history) {
        Future<CachedModels> future = inFlight.get(pipelineId);
        if (future != null) {
            log.info("Joining training already running for pipeline={}", pipelineId);
        } else {
            try {
                future = trainingExecutor.submit(() -> train(pipelineId, history));
            } catch (RejectedExecutionException e) {
                throw new ModelTrainingException("Training pool is saturated, rejected training for pipeline "
                        + pipelineId, e);
            }
            inFlight.put(pipelineId, future);
        }

        try {
            CachedModels trained = future.get(trainingTimeoutSeconds, TimeUnit.SECONDS);
            inFlight.remove(pipelineId, future);
            return trained;
        } catch (TimeoutException e) {
            // Stays in flight; the next lookup picks up its result.
            throw new ModelTrainingException("Training for pipeline " + pipelineId
                    + " did not finish within " + trainingTimeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            inFlight.remove(pipelineId, future);
            throw new ModelTrainingException("Training failed for pipeline " + pipelineId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelTrainingException("Interrupted while training pipeline " + pipelineId, e);
        }
    }

    private CachedModels train(String pipelineId, double[][] history) {
        Span span = tracer.nextSpan()
                .name("model.train")
                .tag("pipeline.id", pipelineId)
                .tag("training.samples", String.valueOf(history.length))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            long started = System.nanoTime();
            IsolationEstimator.Model isolation = isolationEstimator.train(history);
            ReconstructionEstimator.Model reconstruction = reconstructionEstimator
                    .map(estimator -> estimator.train(history))
                    .orElse(null);
            long elapsed = System.nanoTime() - started;

            span.tag("reconstruction", String.valueOf(reconstruction != null));
            metricsConfig.recordTraining(elapsed, reconstruction != null);
            log.info("Trained models for pipeline={}: {} samples, reconstruction={}, took {}ms",
                    pipelineId, history.length, reconstruction != null, TimeUnit.NANOSECONDS.toMillis(elapsed));

            return new CachedModels(pipelineId, clock.getAsLong(),
                    FeatureVectorizer.FEATURE_ORDER_VERSION, isolation, reconstruction);
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private boolean isFresh(CachedModels models, long now) {
        return models.featureOrderVersion() == FeatureVectorizer.FEATURE_ORDER_VERSION
                && now - models.trainedAtNanos() <= ttlNanos;
    }

    private static double ageSeconds(CachedModels models, long now) {
        return (now - models.trainedAtNanos()) / 1e9;
    }

    private ModelMetadata toMetadata(CachedModels models, long now) {
        return ModelMetadata.builder()
                .pipelineId(models.pipelineId())
                .ageSeconds(ageSeconds(models, now))
                .trainingSamples(models.isolation().trainingSamples())
                .treeCount(models.isolation().forest().getTreeCount())
                .featureOrderVersion(models.featureOrderVersion())
                .reconstruction(models.reconstruction() != null)
                .build();
    }
}
