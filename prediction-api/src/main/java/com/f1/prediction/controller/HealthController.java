package com.f1.prediction.controller;

import com.f1.prediction.feature.FeatureCatalog;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.inference.ModelBundle;
import com.f1.prediction.inference.PredictionEngine;
import com.f1.prediction.repository.RacePredictionRepository;
import com.f1.prediction.repository.readonly.RaceResultReadRepository;
import com.f1.prediction.service.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final RaceResultReadRepository raceResultRepository;
    private final RacePredictionRepository predictionRepository;
    private final ModelRegistry modelRegistry;
    private final FeaturePipeline featurePipeline;

    public HealthController(
            RaceResultReadRepository raceResultRepository,
            RacePredictionRepository predictionRepository,
            ModelRegistry modelRegistry,
            FeaturePipeline featurePipeline
    ) {
        this.raceResultRepository = raceResultRepository;
        this.predictionRepository = predictionRepository;
        this.modelRegistry = modelRegistry;
        this.featurePipeline = featurePipeline;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check database connectivity, the feature catalog and whether the loaded models match it")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        // Read access to collector data
        try {
            long resultCount = raceResultRepository.count();
            health.put("raceResultAccess", "OK");
            health.put("raceResultCount", resultCount);
        } catch (Exception e) {
            health.put("raceResultAccess", "ERROR: " + e.getMessage());
        }

        // Write-side collection
        try {
            long predictionCount = predictionRepository.count();
            health.put("predictionDataAccess", "OK");
            health.put("predictionCount", predictionCount);
        } catch (Exception e) {
            health.put("predictionDataAccess", "ERROR: " + e.getMessage());
        }

        health.put("featureCatalogSize", FeatureCatalog.names().size());
        health.put("encodingScheme", featurePipeline.encodingScheme());

        PredictionEngine engine = modelRegistry.currentEngine().orElse(null);
        health.put("modelsLoaded", engine != null);
        if (engine != null) {
            health.put("modelVersion", engine.getModelVersion());
            health.put("featuresZeroFilled", zeroFilledByRole(engine));
        } else {
            health.put("modelError", modelRegistry.status().lastError());
        }

        return health;
    }

    // Model features the pipeline never produces; each is aligned to 0.0 at inference
    private static Map<String, Integer> zeroFilledByRole(PredictionEngine engine) {
        Set<String> catalog = new HashSet<>(FeatureCatalog.names());
        Map<String, Integer> missing = new TreeMap<>();
        for (ModelBundle bundle : engine.getBundles().all()) {
            int count = (int) bundle.getSchema().getFeatureNames().stream()
                    .filter(name -> !catalog.contains(name))
                    .count();
            missing.put(bundle.getRole().name(), count);
        }
        return missing;
    }
}
