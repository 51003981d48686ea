package com.safeops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which path produced a verdict. The label is what reports and responses carry.
 */
public enum ScoringMode {
    FALLBACK("fallback", "rule-fallback"),
    ISOLATION_ONLY("isolation-only", "isolation-forest"),
    ISOLATION_RECONSTRUCTION("isolation+reconstruction", "isolation-forest+autoencoder");

    private final String label;
    private final String modelUsed;

    ScoringMode(String label, String modelUsed) {
        this.label = label;
        this.modelUsed = modelUsed;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    @JsonCreator
    public static ScoringMode fromLabel(String label) {
        for (ScoringMode mode : values()) {
            if (mode.label.equals(label) || mode.name().equals(label)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scoring mode: " + label);
    }
}
