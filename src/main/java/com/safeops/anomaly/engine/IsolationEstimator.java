package com.safeops.anomaly.engine;

import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.engine.isolationforest.IsolationForest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trains and evaluates the per-pipeline Isolation Forest.
 *
 * Scoring:
 *   normality = forest decision value of the standardised candidate (higher = more normal).
 *   The candidate is anomalous when normality < 0.
 *   anomalyScore = clamp(-normality, 0, 1), so clearly normal runs floor at 0.
 */
@Component
public class IsolationEstimator {

    private final DetectorProperties properties;

    public IsolationEstimator(DetectorProperties properties) {
        this.properties = properties;
    }

    public Model train(double[][] history) {
        StandardScaler scaler = StandardScaler.fit(history);
        DetectorProperties.Isolation config = properties.getIsolation();
        IsolationForest forest = IsolationForest.fit(
                scaler.transform(history),
                config.getNumTrees(),
                config.getMaxSamples(),
                properties.getContamination(),
                config.getSeed());
        return new Model(scaler, forest, history.length);
    }

    public Outcome evaluate(Model model, double[] candidate) {
        double[] scaled = model.scaler().transform(candidate);
        double normality = model.forest().decisionFunction(scaled);
        boolean anomaly = normality < 0;
        double anomalyScore = Math.max(0.0, Math.min(1.0, -normality));
        return new Outcome(normality, anomaly, anomalyScore);
    }

    public record Model(StandardScaler scaler, IsolationForest forest, int trainingSamples) {}

    public record Outcome(double normality, boolean anomaly, double anomalyScore) {

        public Map<String, Object> toDetails() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("raw_score", normality);
            details.put("prediction", anomaly ? -1 : 1);
            details.put("anomaly_score", anomalyScore);
            details.put("is_anomaly", anomaly);
            return details;
        }
    }
}
