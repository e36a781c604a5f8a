package com.f1.prediction.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State of the model registry.
 *
 * @param lastError why the last load failed, null after a successful load
 */
public record ModelStatus(
        boolean available,
        String version,
        Instant loadedAt,
        String lastError,
        List<BundleSummary> bundles
) {

    public record BundleSummary(
            String role,
            String version,
            int featureCount,
            String encodingScheme,
            Map<String, Double> trainingMetrics
    ) {
    }
}
