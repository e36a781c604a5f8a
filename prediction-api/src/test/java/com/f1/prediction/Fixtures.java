package com.f1.prediction;

import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;

/**
 * Small builders for race records used across tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * A result at Silverstone; a null position means a DNF, position 1 means a win.
     */
    public static EventRecord result(int season, int round, String driver, String constructor,
                                     Integer position, double points) {
        return result(season, round, driver, constructor, "Silverstone", position, points);
    }

    public static EventRecord result(int season, int round, String driver, String constructor, String circuit,
                                     Integer position, double points) {
        return new EventRecord(season, round, driver, 1, constructor, circuit, "United Kingdom",
                "British Grand Prix", 5.891, position != null ? position : 15, position, 90.1, 89.5, 88.9, 88.9,
                21.0, 35.0, 55.0, 3.0, 0.0, false,
                position, points, position == null, Integer.valueOf(1).equals(position),
                position != null ? "Finished" : "Retired", position != null ? 91.2 : null);
    }

    public static PreRaceAttributes attributes(int season, int round, String driver, String constructor,
                                               Integer grid, Double bestTime) {
        return new PreRaceAttributes(season, round, driver, 44, constructor, "Silverstone", "United Kingdom",
                "British Grand Prix", 5.891, grid, grid, bestTime, bestTime, bestTime, bestTime,
                21.0, 35.0, 55.0, 3.0, 0.0, false);
    }

    public static PreRaceAttributes emptyAttributes(int season, int round, String driver) {
        return new PreRaceAttributes(season, round, driver, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }
}
