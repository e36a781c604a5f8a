package com.f1.prediction.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Names of every feature the pipeline can produce, in catalog order.
 * <p>
 * The catalog is checked against the forbidden outcome fields at startup
 * (see {@code FeatureCatalogVerifier}); add new names here when adding a feature.
 */
public final class FeatureCatalog {

    private FeatureCatalog() {}

    // ============ CONTEXT ============

    public static final String SEASON = "year";
    public static final String ROUND = "round_number";
    public static final String DRIVER_NUMBER = "driver_number";
    public static final String CIRCUIT_LENGTH = "circuit_length";

    // ============ PRE-RACE ============

    public static final String GRID_POSITION = "grid_position";
    public static final String QUALIFYING_POSITION = "qualifying_position";
    public static final String Q1_TIME = "q1_time";
    public static final String Q2_TIME = "q2_time";
    public static final String Q3_TIME = "q3_time";
    public static final String QUALIFYING_BEST_TIME = "qualifying_best_time";
    public static final String QUALIFYING_TIME_FROM_POLE = "qualifying_time_from_pole";

    // ============ WEATHER ============

    public static final String AVG_AIR_TEMP = "avg_air_temp";
    public static final String AVG_TRACK_TEMP = "avg_track_temp";
    public static final String AVG_HUMIDITY = "avg_humidity";
    public static final String AVG_WIND_SPEED = "avg_wind_speed";
    public static final String MAX_RAINFALL = "max_rainfall";
    public static final String HAD_RAIN = "had_rain";

    // ============ HISTORICAL (DRIVER) ============

    public static final String WINS_SO_FAR = "wins_so_far";
    public static final String POINTS_SO_FAR = "points_so_far";
    public static final String PODIUMS_SO_FAR = "podiums_so_far";
    public static final String RACES_SO_FAR = "races_so_far";
    public static final String AVG_POSITION_SO_FAR = "avg_position_so_far";
    public static final String AVG_POSITION_LAST_5 = "avg_position_last_5";
    public static final String POINTS_PER_RACE = "points_per_race";
    public static final String WIN_RATE = "win_rate";
    public static final String PODIUM_RATE = "podium_rate";

    // ============ HISTORICAL (CONSTRUCTOR / CIRCUIT) ============

    public static final String CONSTRUCTOR_POINTS_SO_FAR = "constructor_points_so_far";
    public static final String CONSTRUCTOR_WINS_SO_FAR = "constructor_wins_so_far";
    public static final String CONSTRUCTOR_RACES_SO_FAR = "constructor_races_so_far";
    public static final String CIRCUIT_WINS_HISTORY = "circuit_wins_history";
    public static final String CIRCUIT_RACES_HISTORY = "circuit_races_history";
    public static final String CIRCUIT_AVG_POSITION = "circuit_avg_position";

    // ============ TRANSFORMED ============

    public static final String LOG_SUFFIX = "_log";

    /** Skewed counts and rates that also get a log1p column. */
    public static final List<String> LOG_TRANSFORMED = List.of(
            WINS_SO_FAR,
            WIN_RATE,
            POINTS_SO_FAR,
            PODIUMS_SO_FAR,
            POINTS_PER_RACE,
            PODIUM_RATE,
            CONSTRUCTOR_WINS_SO_FAR,
            CONSTRUCTOR_POINTS_SO_FAR,
            CIRCUIT_WINS_HISTORY
    );

    public static final String GRID_POSITION_NORMALIZED = "grid_position_normalized";
    public static final String CONSTRUCTOR_POINTS_NORMALIZED = "constructor_points_normalized";

    public static final String GRID_QUALIFYING_DIFF = "grid_qualifying_diff";
    public static final String TEMP_TRACK_AIR_DIFF = "temp_track_air_diff";
    public static final String MOMENTUM_POSITION = "momentum_position";

    public static final String GRID_QUALIFYING_INTERACTION = "grid_qualifying_interaction";
    public static final String QUALIFYING_GAP_GRID_INTERACTION = "qualifying_gap_grid_interaction";
    public static final String HISTORICAL_GRID_INTERACTION = "historical_grid_interaction";
    public static final String WIN_RATE_CONSTRUCTOR_INTERACTION = "win_rate_constructor_interaction";
    public static final String POINTS_RECENT_FORM_INTERACTION = "points_recent_form_interaction";

    public static final String WIN_PODIUM_RATIO = "win_podium_ratio";
    public static final String MOMENTUM_SCORE = "momentum_score";
    public static final String POSITION_CONSISTENCY = "position_consistency";
    public static final String PERFORMANCE_INDEX = "performance_index";
    public static final String GRID_ADVANTAGE = "grid_advantage";
    public static final String QUALIFYING_ADVANTAGE = "qualifying_advantage";
    public static final String ESTIMATED_EXPERIENCE = "estimated_experience";

    // Fixed vocabularies; a value outside them falls into the last bucket
    public static final List<String> EXPERIENCE_LEVELS = List.of("rookie", "experienced", "veteran");
    public static final List<String> RAIN_CATEGORIES = List.of("dry", "light", "heavy");
    public static final List<String> QUALIFYING_GAP_CATEGORIES = List.of("close", "medium", "far");

    public static final String EXPERIENCE_LEVEL_PREFIX = "experience_level_";
    public static final String RAIN_CATEGORY_PREFIX = "rain_category_";
    public static final String QUALIFYING_GAP_CATEGORY_PREFIX = "qualifying_gap_category_";

    // ============ ENCODED ============

    public static final String ENCODED_SUFFIX = "_encoded";

    public static final String CIRCUIT_NAME = "circuit_name";
    public static final String COUNTRY = "country";
    public static final String EVENT_NAME = "event_name";
    public static final String DRIVER_CODE = "driver_code";
    public static final String CONSTRUCTOR = "constructor";

    /** Categorical attributes that are hash-encoded. */
    public static final List<String> ENCODED_CATEGORICALS = List.of(
            CIRCUIT_NAME, COUNTRY, EVENT_NAME, DRIVER_CODE, CONSTRUCTOR
    );

    private static final List<String> ALL;
    static {
        List<String> names = new ArrayList<>(List.of(
                SEASON, ROUND, DRIVER_NUMBER, CIRCUIT_LENGTH,
                GRID_POSITION, QUALIFYING_POSITION, Q1_TIME, Q2_TIME, Q3_TIME,
                QUALIFYING_BEST_TIME, QUALIFYING_TIME_FROM_POLE,
                AVG_AIR_TEMP, AVG_TRACK_TEMP, AVG_HUMIDITY, AVG_WIND_SPEED, MAX_RAINFALL, HAD_RAIN,
                WINS_SO_FAR, POINTS_SO_FAR, PODIUMS_SO_FAR, RACES_SO_FAR,
                AVG_POSITION_SO_FAR, AVG_POSITION_LAST_5, POINTS_PER_RACE, WIN_RATE, PODIUM_RATE,
                CONSTRUCTOR_POINTS_SO_FAR, CONSTRUCTOR_WINS_SO_FAR, CONSTRUCTOR_RACES_SO_FAR,
                CIRCUIT_WINS_HISTORY, CIRCUIT_RACES_HISTORY, CIRCUIT_AVG_POSITION
        ));
        for (String name : LOG_TRANSFORMED) {
            names.add(name + LOG_SUFFIX);
        }
        names.addAll(List.of(
                GRID_POSITION_NORMALIZED, CONSTRUCTOR_POINTS_NORMALIZED,
                GRID_QUALIFYING_DIFF, TEMP_TRACK_AIR_DIFF, MOMENTUM_POSITION,
                GRID_QUALIFYING_INTERACTION, QUALIFYING_GAP_GRID_INTERACTION, HISTORICAL_GRID_INTERACTION,
                WIN_RATE_CONSTRUCTOR_INTERACTION, POINTS_RECENT_FORM_INTERACTION,
                WIN_PODIUM_RATIO, MOMENTUM_SCORE, POSITION_CONSISTENCY, PERFORMANCE_INDEX,
                GRID_ADVANTAGE, QUALIFYING_ADVANTAGE, ESTIMATED_EXPERIENCE
        ));
        EXPERIENCE_LEVELS.forEach(level -> names.add(EXPERIENCE_LEVEL_PREFIX + level));
        RAIN_CATEGORIES.forEach(category -> names.add(RAIN_CATEGORY_PREFIX + category));
        QUALIFYING_GAP_CATEGORIES.forEach(category -> names.add(QUALIFYING_GAP_CATEGORY_PREFIX + category));
        ENCODED_CATEGORICALS.forEach(column -> names.add(column + ENCODED_SUFFIX));
        ALL = Collections.unmodifiableList(names);
    }

    /**
     * Every feature name, in catalog order.
     */
    public static List<String> names() {
        return ALL;
    }
}
