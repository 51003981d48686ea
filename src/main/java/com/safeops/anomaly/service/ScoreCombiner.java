package com.safeops.anomaly.service;

import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.engine.IsolationEstimator;
import com.safeops.anomaly.engine.ReconstructionEstimator;
import org.springframework.stereotype.Service;

/**
 * Fuses the model outputs into one score and verdict.
 *
 * With both models: combined = 0.6 x isolation + 0.4 x reconstruction, clamped to [0, 1];
 * anomalous if either model flags the run or combined > 0.7.
 * Isolation only: combined = isolation score; anomalous if the forest flags the run or combined > 0.7.
 */
@Service
public class ScoreCombiner {

    private final DetectorProperties.Decision config;

    public ScoreCombiner(DetectorProperties properties) {
        this.config = properties.getDecision();
    }

    public Combined combine(IsolationEstimator.Outcome isolation) {
        double combined = clamp(isolation.anomalyScore());
        boolean anomaly = isolation.anomaly() || combined > config.getCombinedThreshold();
        return new Combined(combined, anomaly);
    }

    public Combined combine(IsolationEstimator.Outcome isolation, ReconstructionEstimator.Outcome reconstruction) {
        double combined = clamp(config.getIsolationWeight() * isolation.anomalyScore()
                + config.getReconstructionWeight() * reconstruction.anomalyScore());
        boolean anomaly = isolation.anomaly()
                || reconstruction.anomaly()
                || combined > config.getCombinedThreshold();
        return new Combined(combined, anomaly);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public record Combined(double score, boolean anomaly) {}
}
