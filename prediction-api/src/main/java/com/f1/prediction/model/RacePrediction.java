package com.f1.prediction.model;

import java.time.Instant;
import java.util.List;

/**
 * Predictions for a whole field, ordered by predicted finishing position.
 */
public record RacePrediction(
        int season,
        int round,
        String eventName,
        String circuitName,
        String modelVersion,
        Instant generatedAt,
        List<PredictionResult> results
) {

    public RacePrediction {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
