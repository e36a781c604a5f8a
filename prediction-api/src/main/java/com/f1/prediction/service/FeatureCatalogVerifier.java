package com.f1.prediction.service;

import com.f1.prediction.feature.FeatureCatalog;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.feature.FeatureRow;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.validation.LeakageValidator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Startup check that neither the catalog nor what the pipeline actually emits contains an
 * outcome field. Failure prevents the application from starting.
 */
@Component
public class FeatureCatalogVerifier {

    private static final Logger log = LoggerFactory.getLogger(FeatureCatalogVerifier.class);

    private static final PreRaceAttributes SAMPLE = new PreRaceAttributes(2024, 1, "VER", 1, "Red Bull Racing",
            "Sakhir", "Bahrain", "Bahrain Grand Prix", 5.412, 1, 1, 91.3, 90.8, 89.7, 89.7,
            24.0, 31.0, 45.0, 2.1, 0.0, false);

    private final LeakageValidator leakageValidator;
    private final FeaturePipeline pipeline;

    public FeatureCatalogVerifier(LeakageValidator leakageValidator, FeaturePipeline pipeline) {
        this.leakageValidator = leakageValidator;
        this.pipeline = pipeline;
    }

    /**
     * @throws com.f1.prediction.validation.LeakageException if a forbidden name is produced
     * @throws IllegalStateException if the pipeline emits a feature the catalog does not list
     */
    @PostConstruct
    public void verify() {
        List<String> catalog = FeatureCatalog.names();
        leakageValidator.validate(catalog);

        FeatureRow dryRun = pipeline.build(List.of(), SAMPLE, SAMPLE.season(), SAMPLE.round(),
                OptionalDouble.of(SAMPLE.qualifyingBestTime()));
        leakageValidator.validate(dryRun.names());

        Set<String> undocumented = new TreeSet<>(dryRun.names());
        undocumented.removeAll(catalog);
        if (!undocumented.isEmpty()) {
            throw new IllegalStateException("Pipeline emits features missing from the catalog: " + undocumented);
        }
        log.info("Feature catalog verified: {} features, none forbidden", catalog.size());
    }
}
