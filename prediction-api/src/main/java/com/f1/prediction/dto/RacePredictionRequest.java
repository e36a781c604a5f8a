package com.f1.prediction.dto;

import com.f1.prediction.model.PreRaceAttributes;

import java.util.List;

/**
 * An event to predict: event-level context shared by every driver, plus the field.
 * Weather values are the session averages known before the start.
 */
public record RacePredictionRequest(
        Integer season,
        Integer round,
        String eventName,
        String circuitName,
        String country,
        Double circuitLength,
        Double avgAirTemp,
        Double avgTrackTemp,
        Double avgHumidity,
        Double avgWindSpeed,
        Double maxRainfall,
        Boolean hadRain,
        List<DriverEntry> drivers
) {

    /**
     * @throws IllegalArgumentException if season, round or the field is missing
     */
    public List<PreRaceAttributes> toField() {
        if (season == null || round == null || season < 1950 || round < 1) {
            throw new IllegalArgumentException("A valid season and round are required, got " + season + "/" + round);
        }
        if (drivers == null || drivers.isEmpty()) {
            throw new IllegalArgumentException("At least one driver is required");
        }
        return drivers.stream()
                .map(d -> new PreRaceAttributes(season, round, d.driverCode(), d.driverNumber(), d.constructor(),
                        circuitName, country, eventName, circuitLength, d.gridPosition(), d.qualifyingPosition(),
                        d.q1Time(), d.q2Time(), d.q3Time(), d.qualifyingBestTime(),
                        avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain))
                .toList();
    }
}
