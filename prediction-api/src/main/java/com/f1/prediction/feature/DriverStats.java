package com.f1.prediction.feature;

/**
 * Historical statistics for one driver as of (but excluding) a target event.
 * Rates and averages are already defaulted for empty histories, so no field is ever NaN.
 */
public record DriverStats(
        int winsSoFar,
        double pointsSoFar,
        int podiumsSoFar,
        int racesSoFar,
        double avgPositionSoFar,
        double avgPositionLast5,
        double pointsPerRace,
        double winRate,
        double podiumRate,
        double constructorPointsSoFar,
        int constructorWinsSoFar,
        int constructorRacesSoFar,
        int circuitWinsHistory,
        int circuitRacesHistory,
        double circuitAvgPosition
) {

    /**
     * Statistics of a driver with no prior events at all.
     */
    public static DriverStats noHistory() {
        return new DriverStats(0, 0.0, 0, 0,
                FeatureConstants.DEFAULT_AVG_POSITION, FeatureConstants.DEFAULT_AVG_POSITION,
                0.0, 0.0, 0.0,
                0.0, 0, 0,
                0, 0, FeatureConstants.DEFAULT_AVG_POSITION);
    }

    public FeatureRow toFeatureRow() {
        return FeatureRow.builder()
                .put(FeatureCatalog.WINS_SO_FAR, winsSoFar)
                .put(FeatureCatalog.POINTS_SO_FAR, pointsSoFar)
                .put(FeatureCatalog.PODIUMS_SO_FAR, podiumsSoFar)
                .put(FeatureCatalog.RACES_SO_FAR, racesSoFar)
                .put(FeatureCatalog.AVG_POSITION_SO_FAR, avgPositionSoFar)
                .put(FeatureCatalog.AVG_POSITION_LAST_5, avgPositionLast5)
                .put(FeatureCatalog.POINTS_PER_RACE, pointsPerRace)
                .put(FeatureCatalog.WIN_RATE, winRate)
                .put(FeatureCatalog.PODIUM_RATE, podiumRate)
                .put(FeatureCatalog.CONSTRUCTOR_POINTS_SO_FAR, constructorPointsSoFar)
                .put(FeatureCatalog.CONSTRUCTOR_WINS_SO_FAR, constructorWinsSoFar)
                .put(FeatureCatalog.CONSTRUCTOR_RACES_SO_FAR, constructorRacesSoFar)
                .put(FeatureCatalog.CIRCUIT_WINS_HISTORY, circuitWinsHistory)
                .put(FeatureCatalog.CIRCUIT_RACES_HISTORY, circuitRacesHistory)
                .put(FeatureCatalog.CIRCUIT_AVG_POSITION, circuitAvgPosition)
                .build();
    }
}
