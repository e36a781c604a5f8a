package com.f1.prediction.model;

/**
 * Everything known about one driver before the lights go out at the target event.
 * Supplied by the session-loading side; any field may be missing.
 */
public record PreRaceAttributes(
        Integer season,
        Integer round,
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
        Boolean hadRain
) {

    /**
     * Grid position, falling back to the qualifying position when the grid is not known yet.
     */
    public Integer effectiveGridPosition() {
        return gridPosition != null ? gridPosition : qualifyingPosition;
    }

    public PreRaceAttributes withDriverCode(String code) {
        return new PreRaceAttributes(season, round, code, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, gridPosition, qualifyingPosition, q1Time, q2Time, q3Time,
                qualifyingBestTime, avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain);
    }

    public PreRaceAttributes withGrid(Integer grid, Integer qualifying) {
        return new PreRaceAttributes(season, round, driverCode, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, grid, qualifying, q1Time, q2Time, q3Time,
                qualifyingBestTime, avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain);
    }

    public PreRaceAttributes withQualifyingTimes(Double q1, Double q2, Double q3, Double best) {
        return new PreRaceAttributes(season, round, driverCode, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, gridPosition, qualifyingPosition, q1, q2, q3,
                best, avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain);
    }

    public PreRaceAttributes withWeather(Double airTemp, Double trackTemp, Double humidity, Double windSpeed,
                                         Double rainfall) {
        return new PreRaceAttributes(season, round, driverCode, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, gridPosition, qualifyingPosition, q1Time, q2Time, q3Time,
                qualifyingBestTime, airTemp, trackTemp, humidity, windSpeed, rainfall, hadRain);
    }
}
