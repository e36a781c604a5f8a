package com.f1.prediction.inference;

import com.f1.prediction.model.PreRaceAttributes;

import java.util.ArrayList;
import java.util.List;

import static com.f1.prediction.feature.FeatureConstants.MAX_FIELD_SIZE;

/**
 * Detects implausible pre-race attributes and produces a defaulted copy.
 * Missing values are not problems by themselves; the pipeline has defaults for them.
 */
public class PreRaceAttributeValidator {

    static final String UNKNOWN_DRIVER = "UNKNOWN";

    /** Slowest lap time still treated as a real qualifying lap, in seconds. */
    static final double MAX_LAP_TIME = 600.0;

    /**
     * @throws MalformedAttributeException listing every problem found
     */
    public void check(PreRaceAttributes a) {
        List<String> problems = problems(a);
        if (!problems.isEmpty()) {
            throw new MalformedAttributeException(a == null ? null : a.driverCode(), problems);
        }
    }

    /**
     * Returns a copy with every malformed field cleared, so downstream stages apply their defaults.
     */
    public PreRaceAttributes sanitize(PreRaceAttributes a) {
        String code = a.driverCode();
        if (isBlank(code)) {
            code = a.driverNumber() != null ? "#" + a.driverNumber() : UNKNOWN_DRIVER;
        }

        return a.withDriverCode(code)
                .withGrid(validPosition(a.gridPosition()) ? a.gridPosition() : null,
                        validPosition(a.qualifyingPosition()) ? a.qualifyingPosition() : null)
                .withQualifyingTimes(validTime(a.q1Time()), validTime(a.q2Time()), validTime(a.q3Time()),
                        validTime(a.qualifyingBestTime()))
                .withWeather(
                        inRange(a.avgAirTemp(), -10, 60),
                        inRange(a.avgTrackTemp(), -10, 60),
                        inRange(a.avgHumidity(), 0, 100),
                        inRange(a.avgWindSpeed(), 0, Double.MAX_VALUE),
                        inRange(a.maxRainfall(), 0, Double.MAX_VALUE));
    }

    /**
     * Keeps only who and where: driver, constructor and event identity. Every measured value is dropped.
     */
    public PreRaceAttributes identityOnly(PreRaceAttributes a) {
        PreRaceAttributes sanitized = sanitize(a);
        return new PreRaceAttributes(sanitized.season(), sanitized.round(), sanitized.driverCode(),
                sanitized.driverNumber(), sanitized.constructor(), sanitized.circuitName(), sanitized.country(),
                sanitized.eventName(), null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    List<String> problems(PreRaceAttributes a) {
        List<String> problems = new ArrayList<>();
        if (a == null) {
            problems.add("attributes missing");
            return problems;
        }
        if (isBlank(a.driverCode())) {
            problems.add("driver code missing");
        }
        if (!validPosition(a.gridPosition())) {
            problems.add("grid position " + a.gridPosition() + " outside [1, " + MAX_FIELD_SIZE + "]");
        }
        if (!validPosition(a.qualifyingPosition())) {
            problems.add("qualifying position " + a.qualifyingPosition() + " outside [1, " + MAX_FIELD_SIZE + "]");
        }
        checkTime(problems, "q1 time", a.q1Time());
        checkTime(problems, "q2 time", a.q2Time());
        checkTime(problems, "q3 time", a.q3Time());
        checkTime(problems, "qualifying best time", a.qualifyingBestTime());
        checkRange(problems, "air temperature", a.avgAirTemp(), -10, 60);
        checkRange(problems, "track temperature", a.avgTrackTemp(), -10, 60);
        checkRange(problems, "humidity", a.avgHumidity(), 0, 100);
        checkRange(problems, "wind speed", a.avgWindSpeed(), 0, Double.MAX_VALUE);
        checkRange(problems, "rainfall", a.maxRainfall(), 0, Double.MAX_VALUE);
        return problems;
    }

    private static boolean validPosition(Integer position) {
        return position == null || (position >= 1 && position <= MAX_FIELD_SIZE);
    }

    private static Double validTime(Double seconds) {
        return seconds == null || !Double.isFinite(seconds) || seconds <= 0 || seconds > MAX_LAP_TIME
                ? null : seconds;
    }

    private static void checkTime(List<String> problems, String field, Double seconds) {
        if (seconds != null && validTime(seconds) == null) {
            problems.add(field + " " + seconds + " is not a lap time in (0, " + MAX_LAP_TIME + "]");
        }
    }

    private static Double inRange(Double value, double min, double max) {
        return value == null || !Double.isFinite(value) || value < min || value > max ? null : value;
    }

    private static void checkRange(List<String> problems, String field, Double value, double min, double max) {
        if (value != null && inRange(value, min, max) == null) {
            problems.add(field + " " + value + " outside plausible range");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
