package com.f1.prediction.config;

import com.f1.prediction.feature.CategoricalEncoder;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.feature.FeatureTableBuilder;
import com.f1.prediction.feature.FeatureTransformer;
import com.f1.prediction.feature.MomentumWeights;
import com.f1.prediction.feature.StatsAggregator;
import com.f1.prediction.inference.ModelBundleLoader;
import com.f1.prediction.inference.OutputClipper;
import com.f1.prediction.inference.PreRaceAttributeValidator;
import com.f1.prediction.inference.SchemaAligner;
import com.f1.prediction.validation.FeatureRangeValidator;
import com.f1.prediction.validation.ForbiddenFeatures;
import com.f1.prediction.validation.LeakageValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

import static com.f1.prediction.feature.FeatureConstants.RECENT_FORM_WINDOW;

/**
 * Wires the pure pipeline stages. Modeling constants are compile-time values shared with
 * training, so none of them are exposed as properties.
 */
@Configuration
public class FeaturePipelineConfig {

    // ============ VALIDATION ============

    @Bean
    public ForbiddenFeatures forbiddenFeatures() {
        return ForbiddenFeatures.DEFAULT;
    }

    @Bean
    public LeakageValidator leakageValidator(ForbiddenFeatures forbiddenFeatures) {
        return new LeakageValidator(forbiddenFeatures);
    }

    @Bean
    public FeatureRangeValidator featureRangeValidator() {
        return new FeatureRangeValidator();
    }

    // ============ FEATURES ============

    @Bean
    public FeaturePipeline featurePipeline() {
        return new FeaturePipeline(
                new StatsAggregator(RECENT_FORM_WINDOW),
                new FeatureTransformer(MomentumWeights.DEFAULT),
                new CategoricalEncoder());
    }

    @Bean
    public FeatureTableBuilder featureTableBuilder(FeaturePipeline featurePipeline,
                                                   LeakageValidator leakageValidator,
                                                   FeatureRangeValidator featureRangeValidator,
                                                   PreRaceAttributeValidator preRaceAttributeValidator) {
        return new FeatureTableBuilder(featurePipeline, leakageValidator, featureRangeValidator,
                preRaceAttributeValidator);
    }

    // ============ INFERENCE ============

    @Bean
    public SchemaAligner schemaAligner() {
        return new SchemaAligner();
    }

    @Bean
    public OutputClipper outputClipper() {
        return new OutputClipper();
    }

    @Bean
    public PreRaceAttributeValidator preRaceAttributeValidator() {
        return new PreRaceAttributeValidator();
    }

    @Bean
    public ModelBundleLoader modelBundleLoader(ObjectMapper objectMapper, LeakageValidator leakageValidator,
                                               FeaturePipeline featurePipeline) {
        return new ModelBundleLoader(objectMapper, leakageValidator, featurePipeline.encodingScheme());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
