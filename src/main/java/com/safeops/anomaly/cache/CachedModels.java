package com.safeops.anomaly.cache;

import com.safeops.anomaly.engine.IsolationEstimator;
import com.safeops.anomaly.engine.ReconstructionEstimator;

import java.util.Optional;

/**
 * One pipeline's trained models. Replaced as a whole on retrain, never edited in place.
 *
 * @param trainedAtNanos      monotonic clock reading taken when training finished
 * @param featureOrderVersion feature layout the models were trained against
 * @param reconstruction      null when the reconstruction backend is disabled
 */
public record CachedModels(String pipelineId,
                           long trainedAtNanos,
                           int featureOrderVersion,
                           IsolationEstimator.Model isolation,
                           ReconstructionEstimator.Model reconstruction) {

    public Optional<ReconstructionEstimator.Model> reconstructionModel() {
        return Optional.ofNullable(reconstruction);
    }
}
