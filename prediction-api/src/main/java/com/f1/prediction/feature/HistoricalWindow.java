package com.f1.prediction.feature;

import com.f1.prediction.model.EventRecord;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Point-in-time views over the historical event table.
 * <p>
 * Every method returns only records strictly before the target (season, round), ordered
 * chronologically. The target event itself is excluded even when present in the input,
 * so feeding the full table (including the race being featurized) cannot leak its outcome.
 */
public final class HistoricalWindow {

    private HistoricalWindow() {}

    /**
     * All records of one driver before the target event.
     * An empty result means "no history" and is valid.
     */
    public static List<EventRecord> window(Collection<EventRecord> events, String driverCode,
                                           int targetSeason, int targetRound) {
        if (driverCode == null) {
            return List.of();
        }
        return filter(events, targetSeason, targetRound, e -> driverCode.equals(e.driverCode()));
    }

    /**
     * All records of every driver of one constructor before the target event.
     */
    public static List<EventRecord> forConstructor(Collection<EventRecord> events, String constructor,
                                                   int targetSeason, int targetRound) {
        if (constructor == null) {
            return List.of();
        }
        return filter(events, targetSeason, targetRound, e -> constructor.equals(e.constructor()));
    }

    /**
     * A driver's records at one circuit before the target event.
     */
    public static List<EventRecord> forCircuit(Collection<EventRecord> events, String driverCode,
                                               String circuitName, int targetSeason, int targetRound) {
        if (driverCode == null || circuitName == null) {
            return List.of();
        }
        return filter(events, targetSeason, targetRound,
                e -> driverCode.equals(e.driverCode()) && circuitName.equals(e.circuitName()));
    }

    /**
     * Every record before the target event, regardless of driver.
     */
    public static List<EventRecord> before(Collection<EventRecord> events, int targetSeason, int targetRound) {
        return filter(events, targetSeason, targetRound, e -> true);
    }

    private static List<EventRecord> filter(Collection<EventRecord> events, int targetSeason, int targetRound,
                                            Predicate<EventRecord> scope) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        return events.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.isBefore(targetSeason, targetRound))
                .filter(scope)
                .sorted(EventRecord.CHRONOLOGICAL)
                .collect(Collectors.toUnmodifiableList());
    }
}
