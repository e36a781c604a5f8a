package com.f1.prediction.exception;

/**
 * No model bundles are loaded, so predictions cannot be served.
 */
public class PredictionUnavailableException extends RuntimeException {

    public PredictionUnavailableException(String message) {
        super(message);
    }
}
