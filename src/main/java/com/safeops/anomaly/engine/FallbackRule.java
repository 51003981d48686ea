package com.safeops.anomaly.engine;

import com.safeops.anomaly.config.DetectorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic verdict for pipelines without enough history to train on.
 * Flags a run that leaked secrets, attempted a bypass, logged 3+ errors,
 * carries severity 80+ or ran for 10 minutes or longer. Score is 1.0 or 0.0.
 */
@Component
public class FallbackRule {

    private final DetectorProperties.Fallback limits;

    public FallbackRule(DetectorProperties properties) {
        this.limits = properties.getFallback();
    }

    public Result evaluate(double[] features) {
        List<String> triggered = new ArrayList<>();

        if (features[FeatureVectorizer.SECRETS] > 0) triggered.add("secrets_count>0");
        if (features[FeatureVectorizer.BYPASS] > 0) triggered.add("bypass_count>0");
        if (features[FeatureVectorizer.ERRORS] >= limits.getErrorCount()) {
            triggered.add("error_count>=" + limits.getErrorCount());
        }
        if (features[FeatureVectorizer.SEVERITY] >= limits.getSeverityScore()) {
            triggered.add("severity_score>=" + formatLimit(limits.getSeverityScore()));
        }
        if (features[FeatureVectorizer.DURATION] >= limits.getDurationSec()) {
            triggered.add("duration_sec>=" + formatLimit(limits.getDurationSec()));
        }

        boolean anomaly = !triggered.isEmpty();
        return new Result(anomaly ? 1.0 : 0.0, anomaly, Collections.unmodifiableList(triggered));
    }

    private static String formatLimit(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    public record Result(double score, boolean anomaly, List<String> triggeredConditions) {}
}
