package com.f1.prediction.feature;

/**
 * Modeling constants shared by training and inference.
 * <p>
 * These are deliberately not configurable through the environment: a model is only
 * valid against the values it was trained with, so changing one of them is a
 * model-breaking change and requires retraining.
 */
public final class FeatureConstants {

    private FeatureConstants() {}

    /** Number of most recent classified finishes used for the recent-form average. */
    public static final int RECENT_FORM_WINDOW = 5;

    /** Grid positions are normalized against this fixed range. */
    public static final int GRID_POSITION_MIN = 1;
    public static final int GRID_POSITION_MAX = 20;

    /** Largest field ever started; grid and qualifying positions beyond it are malformed. */
    public static final int MAX_FIELD_SIZE = 26;

    /** Neutral midpoint of the 1..20 range, used for positional averages without history. */
    public static final double DEFAULT_AVG_POSITION = 10.5;

    /** Inverted position scales ("21 - position") are based on this. */
    public static final int POSITION_INVERSION_BASE = GRID_POSITION_MAX + 1;

    /** Upper bound for cumulative constructor points when normalizing to [0, 1]. */
    public static final double CONSTRUCTOR_POINTS_UPPER_BOUND = 4000.0;

    /** Points for a win plus the fastest lap bonus. */
    public static final double MAX_POINTS_PER_EVENT = 26.0;

    /** Reference for scaling points-per-race into the performance index. */
    public static final double WIN_POINTS = 25.0;

    /** Experience buckets (races so far). */
    public static final int ROOKIE_MAX_RACES = 10;
    public static final int EXPERIENCED_MAX_RACES = 50;

    /** Rain buckets (max rainfall). */
    public static final double DRY_MAX_RAINFALL = 0.1;
    public static final double LIGHT_MAX_RAINFALL = 1.0;

    /** Qualifying gap buckets (seconds to pole). */
    public static final double CLOSE_MAX_GAP_SECONDS = 0.5;
    public static final double MEDIUM_MAX_GAP_SECONDS = 2.0;

    /** Gap to pole assumed for a driver without a qualifying time. */
    public static final double UNKNOWN_QUALIFYING_GAP_SECONDS = 10.0;
}
