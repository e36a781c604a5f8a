package com.f1.prediction.feature;

import com.f1.prediction.inference.PreRaceAttributeValidator;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.validation.FeatureRangeValidator;
import com.f1.prediction.validation.LeakageValidator;
import com.f1.prediction.validation.TemporalConsistencyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Featurizes every historical (season, round, driver) with the same pipeline used at inference.
 * Each row only sees records strictly before its own event, and its attributes go through the
 * same {@link PreRaceAttributeValidator#sanitize} step the engine applies to a malformed driver.
 */
public class FeatureTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(FeatureTableBuilder.class);

    private final FeaturePipeline pipeline;
    private final LeakageValidator leakageValidator;
    private final FeatureRangeValidator rangeValidator;
    private final PreRaceAttributeValidator attributeValidator;

    public FeatureTableBuilder(FeaturePipeline pipeline, LeakageValidator leakageValidator,
                               FeatureRangeValidator rangeValidator, PreRaceAttributeValidator attributeValidator) {
        this.pipeline = pipeline;
        this.leakageValidator = leakageValidator;
        this.rangeValidator = rangeValidator;
        this.attributeValidator = attributeValidator;
    }

    /**
     * Rows for every event with {@code fromSeason <= season <= toSeason}; earlier records only feed history.
     *
     * @param strictRanges raise on out-of-range values instead of logging them
     * @throws com.f1.prediction.validation.LeakageException if any produced name is forbidden
     * @throws com.f1.prediction.validation.DataQualityException on range problems in strict mode
     */
    public FeatureTable build(Collection<EventRecord> history, int fromSeason, int toSeason, boolean strictRanges) {
        if (fromSeason > toSeason) {
            throw new IllegalArgumentException("fromSeason " + fromSeason + " is after toSeason " + toSeason);
        }

        Map<String, List<EventRecord>> events = groupByEvent(history, fromSeason, toSeason);
        List<TrainingExample> examples = new ArrayList<>();
        for (List<EventRecord> event : events.values()) {
            List<PreRaceAttributes> field = event.stream()
                    .map(e -> attributeValidator.sanitize(e.preRace()))
                    .toList();
            OptionalDouble poleTime = FeaturePipeline.poleTime(field);
            for (int i = 0; i < event.size(); i++) {
                EventRecord record = event.get(i);
                FeatureRow row = pipeline.build(history, field.get(i), record.season(), record.round(), poleTime);
                examples.add(new TrainingExample(record.season(), record.round(), record.driverCode(), row,
                        record.winner() ? 1 : 0, record.isClassified() ? record.finishingPosition() : null,
                        record.points()));
            }
        }

        FeatureTable table = new FeatureTable(examples, pipeline.encodingScheme(), List.of());
        leakageValidator.validate(table.getFeatureNames());
        table = table.withDataQualityIssues(rangeValidator.validate(table.rows(), strictRanges));

        log.info("Built feature table {}-{}: {} rows from {} events, {} features",
                fromSeason, toSeason, table.size(), events.size(), table.getFeatureNames().size());
        return table;
    }

    /**
     * As {@link #build}, for a training run cut off at (cutoffSeason, cutoffRound): the supplied history
     * must not contain that event or anything after it.
     *
     * @throws com.f1.prediction.validation.DataQualityException if the history reaches the cutoff
     */
    public FeatureTable buildBefore(Collection<EventRecord> history, int fromSeason, int cutoffSeason,
                                    int cutoffRound, boolean strictRanges) {
        TemporalConsistencyValidator.validate(history, cutoffSeason, cutoffRound);
        return build(history, fromSeason, cutoffSeason, strictRanges);
    }

    private static Map<String, List<EventRecord>> groupByEvent(Collection<EventRecord> history,
                                                                int fromSeason, int toSeason) {
        Map<String, List<EventRecord>> events = new TreeMap<>();
        history.stream()
                .filter(e -> e.season() >= fromSeason && e.season() <= toSeason)
                .sorted(EventRecord.CHRONOLOGICAL)
                .forEach(e -> events.computeIfAbsent(eventKey(e), k -> new ArrayList<>()).add(e));
        return events;
    }

    // Zero-padded so the map iterates chronologically
    private static String eventKey(EventRecord e) {
        return String.format("%04d-%03d", e.season(), e.round());
    }
}
