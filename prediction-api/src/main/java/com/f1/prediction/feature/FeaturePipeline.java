package com.f1.prediction.feature;

import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

import static com.f1.prediction.feature.FeatureCatalog.*;
import static com.f1.prediction.feature.FeatureConstants.*;

/**
 * Builds the feature row of one driver at one target event:
 * pre-race attributes, then historical aggregates, then transforms, then categorical codes.
 * <p>
 * Each stage is pure; the pipeline holds no state besides its stage instances and is safe
 * to share between threads.
 */
public class FeaturePipeline {

    private final StatsAggregator statsAggregator;
    private final FeatureTransformer transformer;
    private final CategoricalEncoder encoder;

    public FeaturePipeline(StatsAggregator statsAggregator, FeatureTransformer transformer,
                           CategoricalEncoder encoder) {
        this.statsAggregator = statsAggregator;
        this.transformer = transformer;
        this.encoder = encoder;
    }

    /**
     * @param history      historical table; records at or after the target are ignored
     * @param attributes   the driver's pre-race attributes
     * @param targetSeason season of the event being featurized
     * @param targetRound  round of the event being featurized
     * @param poleTime     fastest qualifying time of the field, if known
     */
    public FeatureRow build(Collection<EventRecord> history, PreRaceAttributes attributes,
                            int targetSeason, int targetRound, OptionalDouble poleTime) {
        FeatureRow base = baseRow(attributes, targetSeason, targetRound, poleTime);

        DriverStats stats = statsAggregator.aggregate(history, attributes.driverCode(), attributes.constructor(),
                attributes.circuitName(), targetSeason, targetRound);

        FeatureRow withStats = base.toBuilder()
                .putAll(stats.toFeatureRow())
                .build();

        return encoder.encode(transformer.transform(withStats), attributes);
    }

    /**
     * Fastest qualifying time among the field; empty if nobody set a time.
     */
    public static OptionalDouble poleTime(Collection<PreRaceAttributes> field) {
        return field.stream()
                .filter(Objects::nonNull)
                .map(PreRaceAttributes::qualifyingBestTime)
                .filter(t -> t != null && Double.isFinite(t) && t > 0)
                .mapToDouble(Double::doubleValue)
                .min();
    }

    public String encodingScheme() {
        return encoder.scheme();
    }

    FeatureRow baseRow(PreRaceAttributes a, int targetSeason, int targetRound, OptionalDouble poleTime) {
        Integer grid = a.effectiveGridPosition();
        double gridValue = grid != null ? grid : DEFAULT_AVG_POSITION;
        double qualifyingValue = a.qualifyingPosition() != null ? a.qualifyingPosition() : gridValue;

        double gapToPole = UNKNOWN_QUALIFYING_GAP_SECONDS;
        if (a.qualifyingBestTime() != null && poleTime.isPresent()) {
            gapToPole = Math.max(0.0, a.qualifyingBestTime() - poleTime.getAsDouble());
        }

        return FeatureRow.builder()
                .put(SEASON, targetSeason)
                .put(ROUND, targetRound)
                .put(DRIVER_NUMBER, a.driverNumber() != null ? a.driverNumber() : 0)
                .putOrDefault(CIRCUIT_LENGTH, a.circuitLength(), 0.0)
                .put(GRID_POSITION, gridValue)
                .put(QUALIFYING_POSITION, qualifyingValue)
                .putOrDefault(Q1_TIME, a.q1Time(), 0.0)
                .putOrDefault(Q2_TIME, a.q2Time(), 0.0)
                .putOrDefault(Q3_TIME, a.q3Time(), 0.0)
                .putOrDefault(QUALIFYING_BEST_TIME, a.qualifyingBestTime(), 0.0)
                .put(QUALIFYING_TIME_FROM_POLE, gapToPole)
                .putOrDefault(AVG_AIR_TEMP, a.avgAirTemp(), 0.0)
                .putOrDefault(AVG_TRACK_TEMP, a.avgTrackTemp(), 0.0)
                .putOrDefault(AVG_HUMIDITY, a.avgHumidity(), 0.0)
                .putOrDefault(AVG_WIND_SPEED, a.avgWindSpeed(), 0.0)
                .putOrDefault(MAX_RAINFALL, a.maxRainfall(), 0.0)
                .put(HAD_RAIN, Boolean.TRUE.equals(a.hadRain()))
                .build();
    }
}
