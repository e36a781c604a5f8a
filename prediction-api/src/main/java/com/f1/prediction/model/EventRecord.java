package com.f1.prediction.model;

import java.util.Comparator;

/**
 * One driver's result and context for one (season, round).
 * <p>
 * Owned by the data-collection side and read-only here. The outcome fields
 * ({@code finishingPosition}, {@code points}, {@code dnf}, {@code winner}, {@code status},
 * {@code fastestLapTime}) may only ever feed statistics about later events.
 */
public record EventRecord(
        int season,
        int round,
        String driverCode,
        Integer driverNumber,
        String constructor,
        String circuitName,
        String country,
        String eventName,
        Double circuitLength,
        Integer gridPosition,
        Integer qualifyingPosition,
        Double q1Time,
        Double q2Time,
        Double q3Time,
        Double qualifyingBestTime,
        Double avgAirTemp,
        Double avgTrackTemp,
        Double avgHumidity,
        Double avgWindSpeed,
        Double maxRainfall,
        Boolean hadRain,
        Integer finishingPosition,
        double points,
        boolean dnf,
        boolean winner,
        String status,
        Double fastestLapTime
) {

    /** Chronological order: season, then round, then driver code for a stable tie-break. */
    public static final Comparator<EventRecord> CHRONOLOGICAL = Comparator
            .comparingInt(EventRecord::season)
            .thenComparingInt(EventRecord::round)
            .thenComparing(EventRecord::driverCode, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * True if this record happened strictly before the given (season, round).
     */
    public boolean isBefore(int targetSeason, int targetRound) {
        return season < targetSeason || (season == targetSeason && round < targetRound);
    }

    public boolean isAt(int targetSeason, int targetRound) {
        return season == targetSeason && round == targetRound;
    }

    /** Classified finish with a known position. */
    public boolean isClassified() {
        return !dnf && finishingPosition != null;
    }

    public boolean isPodium() {
        return finishingPosition != null && finishingPosition <= 3;
    }

    /**
     * The pre-race projection of this record, as it would have been supplied before the race.
     */
    public PreRaceAttributes preRace() {
        return new PreRaceAttributes(season, round, driverCode, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, gridPosition, qualifyingPosition, q1Time, q2Time, q3Time,
                qualifyingBestTime, avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain);
    }
}
