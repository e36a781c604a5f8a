package com.f1.prediction.validation;

import com.f1.prediction.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks that records used for a target event all precede it.
 */
public final class TemporalConsistencyValidator {

    private static final Logger log = LoggerFactory.getLogger(TemporalConsistencyValidator.class);

    private TemporalConsistencyValidator() {}

    /**
     * @throws DataQualityException if any record is at or after (season, round)
     */
    public static void validate(Collection<EventRecord> records, int season, int round) {
        List<EventRecord> future = records.stream()
                .filter(e -> !e.isBefore(season, round))
                .collect(Collectors.toList());

        if (!future.isEmpty()) {
            TreeSet<String> events = future.stream()
                    .map(e -> e.season() + "/" + e.round())
                    .collect(Collectors.toCollection(TreeSet::new));
            log.error("Temporal inconsistency: {} records at or after {} round {}", future.size(), season, round);
            throw new DataQualityException("Temporal inconsistency",
                    List.of(future.size() + " records at or after " + season + " round " + round + ": " + events));
        }
        log.debug("Temporal consistency validated: {} records before {} round {}", records.size(), season, round);
    }
}
