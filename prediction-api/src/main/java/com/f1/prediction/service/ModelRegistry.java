package com.f1.prediction.service;

import com.f1.prediction.config.ModelBundleProperties;
import com.f1.prediction.dto.ModelStatus;
import com.f1.prediction.exception.PredictionUnavailableException;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.inference.ModelBundle;
import com.f1.prediction.inference.ModelBundleLoadException;
import com.f1.prediction.inference.ModelBundleLoader;
import com.f1.prediction.inference.ModelBundleSet;
import com.f1.prediction.inference.OutputClipper;
import com.f1.prediction.inference.PreRaceAttributeValidator;
import com.f1.prediction.inference.PredictionEngine;
import com.f1.prediction.inference.SchemaAligner;
import com.f1.prediction.validation.LeakageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Holds the engine built from the current model bundles.
 * <p>
 * A reload builds a complete new engine before publishing it, so readers see either the old
 * bundles or the new ones. A failed load leaves the service running without predictions.
 */
@Service
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ModelBundleLoader loader;
    private final ModelBundleProperties properties;
    private final FeaturePipeline pipeline;
    private final SchemaAligner aligner;
    private final OutputClipper clipper;
    private final PreRaceAttributeValidator attributeValidator;
    private final Clock clock;

    private volatile PredictionEngine engine;
    private volatile Instant loadedAt;
    private volatile String lastError;

    public ModelRegistry(
            ModelBundleLoader loader,
            ModelBundleProperties properties,
            FeaturePipeline pipeline,
            SchemaAligner aligner,
            OutputClipper clipper,
            PreRaceAttributeValidator attributeValidator,
            Clock clock
    ) {
        this.loader = loader;
        this.properties = properties;
        this.pipeline = pipeline;
        this.aligner = aligner;
        this.clipper = clipper;
        this.attributeValidator = attributeValidator;
        this.clock = clock;
    }

    @PostConstruct
    void loadOnStartup() {
        if (!properties.isLoadOnStartup()) {
            log.info("Model loading on startup disabled");
            lastError = "Not loaded";
            return;
        }
        reload(properties.getVersion());
    }

    /**
     * Loads the configured version again.
     */
    public ModelStatus reload() {
        return reload(properties.getVersion());
    }

    /**
     * Loads the given version and publishes it; on failure the previous engine is withdrawn
     * rather than kept, so a broken bundle directory is never silently ignored.
     */
    public synchronized ModelStatus reload(String version) {
        Path baseDir = Path.of(properties.getBaseDir());
        try {
            ModelBundleSet bundles = loader.load(baseDir, version);
            engine = new PredictionEngine(pipeline, aligner, clipper, attributeValidator, bundles, clock);
            loadedAt = clock.instant();
            lastError = null;
            log.info("Model registry serving version {}", bundles.getVersion());
        } catch (ModelBundleLoadException | LeakageException e) {
            engine = null;
            loadedAt = null;
            lastError = e.getMessage();
            log.error("Model bundles unavailable, predictions disabled: {}", e.getMessage());
        } catch (RuntimeException e) {
            engine = null;
            loadedAt = null;
            lastError = "Unexpected error loading version " + version + ": " + e;
            log.error("Model bundles unavailable, predictions disabled", e);
        }
        return status();
    }

    public Optional<PredictionEngine> currentEngine() {
        return Optional.ofNullable(engine);
    }

    /**
     * @throws PredictionUnavailableException if no bundles are loaded
     */
    public PredictionEngine requireEngine() {
        PredictionEngine current = engine;
        if (current == null) {
            throw new PredictionUnavailableException("Prediction models are not loaded"
                    + (lastError != null ? ": " + lastError : ""));
        }
        return current;
    }

    public boolean isAvailable() {
        return engine != null;
    }

    public ModelStatus status() {
        PredictionEngine current = engine;
        if (current == null) {
            return new ModelStatus(false, null, null, lastError, List.of());
        }
        List<ModelStatus.BundleSummary> bundles = current.getBundles().all().stream()
                .sorted(Comparator.comparing(ModelBundle::getRole))
                .map(b -> new ModelStatus.BundleSummary(b.getRole().name(), b.getVersion(), b.getSchema().size(),
                        b.getSchema().getEncodingScheme(), b.getMetadata().trainingMetrics()))
                .toList();
        return new ModelStatus(true, current.getModelVersion(), loadedAt, null, bundles);
    }

    public List<String> availableVersions() {
        try {
            return loader.listVersions(Path.of(properties.getBaseDir()));
        } catch (ModelBundleLoadException e) {
            log.warn("Cannot list model versions: {}", e.getMessage());
            return List.of();
        }
    }
}
