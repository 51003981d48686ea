package com.safeops.anomaly.engine;

import com.safeops.anomaly.model.RunRecord;

/**
 * Maps a run record to the 7-dimensional feature vector shared by training and scoring.
 *
 * Features:
 *   [0] duration in seconds
 *   [1] error count
 *   [2] secrets found
 *   [3] URLs referenced
 *   [4] bypass attempts
 *   [5] executed steps
 *   [6] severity score
 *
 * Absent values become 0.0. No range checks: negative counts pass through unchanged.
 * Any change to the order or meaning of the columns must bump {@link #FEATURE_ORDER_VERSION}
 * so cached models trained on the old layout are discarded.
 */
public final class FeatureVectorizer {

    public static final int FEATURE_COUNT = 7;

    public static final int FEATURE_ORDER_VERSION = 1;

    public static final String[] FEATURE_NAMES = {
            "duration_sec",
            "error_count",
            "secrets_count",
            "urls_count",
            "bypass_count",
            "steps_count",
            "severity_score"
    };

    public static final int DURATION = 0;
    public static final int ERRORS = 1;
    public static final int SECRETS = 2;
    public static final int URLS = 3;
    public static final int BYPASS = 4;
    public static final int STEPS = 5;
    public static final int SEVERITY = 6;

    private FeatureVectorizer() {}

    public static double[] vectorize(RunRecord record) {
        double[] features = new double[FEATURE_COUNT];
        if (record == null) return features;

        features[DURATION] = orZero(record.getDurationSec());
        features[ERRORS] = orZero(record.getErrorCount());
        features[SECRETS] = orZero(record.getSecretsCount());
        features[URLS] = orZero(record.getUrlsCount());
        features[BYPASS] = orZero(record.getBypassCount());
        features[STEPS] = orZero(record.getStepsCount());
        features[SEVERITY] = orZero(record.getSeverityScore());
        return features;
    }

    private static double orZero(Number value) {
        return value == null ? 0.0 : value.doubleValue();
    }
}
