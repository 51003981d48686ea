package com.safeops.anomaly.cache;

/**
 * Training failed or did not finish within the configured timeout.
 */
public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
