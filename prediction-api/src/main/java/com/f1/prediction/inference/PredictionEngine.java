package com.f1.prediction.inference;

import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.feature.FeatureRow;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.model.PredictionResult;
import com.f1.prediction.model.RacePrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Runs the three models over every driver of a field.
 * <p>
 * Each driver's row is built, aligned to each model's schema, scored and clipped independently.
 * A problem with one driver's inputs is logged and defaulted; it never aborts the field.
 * Engines are immutable and bound to one {@link ModelBundleSet}.
 */
public class PredictionEngine {

    private static final Logger log = LoggerFactory.getLogger(PredictionEngine.class);

    static final double WINNER_THRESHOLD = 0.5;

    private static final Comparator<PredictionResult> BY_PREDICTED_POSITION = Comparator
            .comparingDouble(PredictionResult::predictedPosition)
            .thenComparing(Comparator.comparingDouble(PredictionResult::winProbability).reversed())
            .thenComparing(PredictionResult::driverCode, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FeaturePipeline pipeline;
    private final SchemaAligner aligner;
    private final OutputClipper clipper;
    private final PreRaceAttributeValidator attributeValidator;
    private final ModelBundleSet bundles;
    private final Clock clock;

    public PredictionEngine(FeaturePipeline pipeline, SchemaAligner aligner, OutputClipper clipper,
                            PreRaceAttributeValidator attributeValidator, ModelBundleSet bundles, Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.clipper = Objects.requireNonNull(clipper, "clipper");
        this.attributeValidator = Objects.requireNonNull(attributeValidator, "attributeValidator");
        this.bundles = Objects.requireNonNull(bundles, "bundles");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param history historical events; anything at or after the target is ignored
     * @param season  target season
     * @param round   target round
     * @param field   pre-race attributes of every starter
     * @throws IllegalArgumentException if the field is empty
     */
    public RacePrediction predict(Collection<EventRecord> history, int season, int round,
                                  List<PreRaceAttributes> field) {
        if (field == null || field.isEmpty()) {
            throw new IllegalArgumentException("Cannot predict an empty field for " + season + "/" + round);
        }

        List<DriverInput> inputs = new ArrayList<>(field.size());
        for (PreRaceAttributes attributes : field) {
            if (attributes != null) {
                inputs.add(prepare(attributes));
            }
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Field for " + season + "/" + round + " has no drivers");
        }

        int fieldSize = inputs.size();
        OptionalDouble poleTime = FeaturePipeline.poleTime(inputs.stream().map(DriverInput::attributes).toList());
        log.info("Predicting {}/{}: {} drivers, {} historical records, model version {}",
                season, round, fieldSize, history == null ? 0 : history.size(), bundles.getVersion());

        List<PredictionResult> results = new ArrayList<>(fieldSize);
        for (DriverInput input : inputs) {
            results.add(predictIsolated(history, season, round, input, poleTime, fieldSize));
        }
        results.sort(BY_PREDICTED_POSITION);

        PreRaceAttributes first = inputs.get(0).attributes();
        return new RacePrediction(season, round, first.eventName(), first.circuitName(),
                bundles.getVersion(), clock.instant(), results);
    }

    public String getModelVersion() {
        return bundles.getVersion();
    }

    public ModelBundleSet getBundles() {
        return bundles;
    }

    private PredictionResult predictIsolated(Collection<EventRecord> history, int season, int round,
                                             DriverInput input, OptionalDouble poleTime, int fieldSize) {
        try {
            return predictDriver(history, season, round, input, poleTime, fieldSize);
        } catch (RuntimeException e) {
            PreRaceAttributes fallback = attributeValidator.identityOnly(input.attributes());
            log.error("Prediction failed for driver {} at {}/{}, retrying with defaulted attributes: {}",
                    fallback.driverCode(), season, round, e.getMessage(), e);
            return predictDriver(history, season, round, new DriverInput(fallback, true), poleTime, fieldSize);
        }
    }

    private PredictionResult predictDriver(Collection<EventRecord> history, int season, int round,
                                           DriverInput input, OptionalDouble poleTime, int fieldSize) {
        PreRaceAttributes attributes = input.attributes();
        FeatureRow row = pipeline.build(history, attributes, season, round, poleTime);

        double winProbability = score(ModelRole.WIN_CLASSIFIER, row, attributes.driverCode(), 1.0 / fieldSize);
        double position = score(ModelRole.POSITION_REGRESSOR, row, attributes.driverCode(), (fieldSize + 1) / 2.0);
        double points = score(ModelRole.POINTS_REGRESSOR, row, attributes.driverCode(), 0.0);

        winProbability = clipper.clipProbability(winProbability);
        position = clipper.clipPosition(position, fieldSize);
        points = clipper.clipPoints(points);

        return new PredictionResult(attributes.driverCode(), attributes.driverNumber(), attributes.constructor(),
                attributes.effectiveGridPosition(), winProbability, position, points, input.defaulted(),
                winProbability > WINNER_THRESHOLD);
    }

    private double score(ModelRole role, FeatureRow row, String driverCode, double fallback) {
        ModelBundle bundle = bundles.get(role);
        AlignedVector vector = aligner.align(row, bundle.getSchema());
        double raw = bundle.getModel().predict(vector.values());
        if (!Double.isFinite(raw)) {
            log.warn("{} produced a non-finite output for driver {}, using {}", role, driverCode, fallback);
            return fallback;
        }
        return raw;
    }

    private DriverInput prepare(PreRaceAttributes attributes) {
        try {
            attributeValidator.check(attributes);
            return new DriverInput(attributes, false);
        } catch (MalformedAttributeException e) {
            PreRaceAttributes sanitized = attributeValidator.sanitize(attributes);
            log.warn("{}; continuing with defaults as driver {}", e.getMessage(), sanitized.driverCode());
            return new DriverInput(sanitized, true);
        }
    }

    private record DriverInput(PreRaceAttributes attributes, boolean defaulted) {
    }
}
