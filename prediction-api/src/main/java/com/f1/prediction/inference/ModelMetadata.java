package com.f1.prediction.inference;

import java.util.Map;

/**
 * Version and training metrics recorded with a bundle.
 */
public record ModelMetadata(String version, Map<String, Double> trainingMetrics) {

    public ModelMetadata {
        trainingMetrics = trainingMetrics != null ? Map.copyOf(trainingMetrics) : Map.of();
    }
}
