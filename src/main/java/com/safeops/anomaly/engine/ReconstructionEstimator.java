package com.safeops.anomaly.engine;

import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.engine.autoencoder.Autoencoder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trains and evaluates the per-pipeline autoencoder. Only registered when
 * {@code detector.reconstruction.enabled} is true; callers receive it as an optional capability.
 *
 * Scoring:
 *   error     = mean squared difference between the standardised candidate and its reconstruction
 *   threshold = 90th percentile of the errors of the most recent (up to 200) historical rows,
 *               recomputed on every call against the model passed in
 *   score     = min(1, error / (threshold + 1e-9)); anomalous when error > threshold
 */
@Component
@ConditionalOnProperty(prefix = "detector.reconstruction", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconstructionEstimator {

    static final double EPSILON = 1e-9;

    private final DetectorProperties.Reconstruction config;

    public ReconstructionEstimator(DetectorProperties properties) {
        this.config = properties.getReconstruction();
    }

    public Model train(double[][] history) {
        StandardScaler scaler = StandardScaler.fit(history);
        Autoencoder autoencoder = Autoencoder.train(
                scaler.transform(history),
                Autoencoder.DEFAULT_WIDTHS,
                config.getEpochs(),
                config.getBatchSize(),
                config.getLearningRate(),
                config.getSeed());
        return new Model(scaler, autoencoder, history.length);
    }

    /**
     * @param history most recent first; the threshold uses its leading rows
     */
    public Outcome evaluate(Model model, double[] candidate, double[][] history) {
        double error = model.autoencoder().reconstructionError(model.scaler().transform(candidate));

        int sampleSize = Math.min(history.length, config.getThresholdSampleSize());
        double threshold;
        if (sampleSize == 0) {
            threshold = 0.0;
        } else {
            double[] errors = new double[sampleSize];
            for (int i = 0; i < sampleSize; i++) {
                errors[i] = model.autoencoder().reconstructionError(model.scaler().transform(history[i]));
            }
            threshold = Percentiles.of(errors, config.getThresholdPercentile());
        }

        double anomalyScore = Math.min(1.0, error / (threshold + EPSILON));
        return new Outcome(error, threshold, anomalyScore, error > threshold);
    }

    public record Model(StandardScaler scaler, Autoencoder autoencoder, int trainingSamples) {}

    public record Outcome(double error, double threshold, double anomalyScore, boolean anomaly) {

        public Map<String, Object> toDetails() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reconstruction_error", error);
            details.put("threshold", threshold);
            details.put("anomaly_score", anomalyScore);
            details.put("is_anomaly", anomaly);
            return details;
        }
    }
}
