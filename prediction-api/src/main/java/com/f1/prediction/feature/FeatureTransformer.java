package com.f1.prediction.feature;

import java.util.List;

import static com.f1.prediction.feature.FeatureCatalog.*;
import static com.f1.prediction.feature.FeatureConstants.*;

/**
 * Deterministic numeric transforms over a feature row.
 * <p>
 * All bounds are fixed constants, never derived from the current batch, so a row
 * transforms identically whether it is scored alone or as part of a full field.
 * Inputs missing from the row fall back to the same neutral defaults the pipeline uses.
 */
public class FeatureTransformer {

    private final MomentumWeights momentumWeights;

    public FeatureTransformer() {
        this(MomentumWeights.DEFAULT);
    }

    public FeatureTransformer(MomentumWeights momentumWeights) {
        this.momentumWeights = momentumWeights;
    }

    /**
     * Returns a new row holding the input features plus every derived feature.
     */
    public FeatureRow transform(FeatureRow row) {
        FeatureRow.Builder out = row.toBuilder();
        addLogTransforms(row, out);
        addNormalized(row, out);
        addDifferences(row, out);
        addInteractions(row, out);
        addComposites(row, out);
        addBuckets(row, out);
        return out.build();
    }

    // ============ LOG TRANSFORMS ============

    private void addLogTransforms(FeatureRow row, FeatureRow.Builder out) {
        for (String name : LOG_TRANSFORMED) {
            out.put(name + LOG_SUFFIX, log1p(row.getOrDefault(name, 0.0)));
        }
    }

    // Aggregates are non-negative by construction; clamp anyway so log1p never sees x <= -1
    static double log1p(double value) {
        return Math.log1p(Math.max(0.0, value));
    }

    // ============ NORMALIZATION ============

    private void addNormalized(FeatureRow row, FeatureRow.Builder out) {
        double grid = grid(row);
        out.put(GRID_POSITION_NORMALIZED, normalizeGrid(grid));
        out.put(CONSTRUCTOR_POINTS_NORMALIZED,
                clamp(row.getOrDefault(CONSTRUCTOR_POINTS_SO_FAR, 0.0) / CONSTRUCTOR_POINTS_UPPER_BOUND, 0.0, 1.0));
    }

    /**
     * Maps a grid position onto [0, 1] against the fixed 1..20 range (pole = 0).
     */
    public static double normalizeGrid(double grid) {
        double span = GRID_POSITION_MAX - GRID_POSITION_MIN;
        return clamp((grid - GRID_POSITION_MIN) / span, 0.0, 1.0);
    }

    // ============ DIFFERENCES ============

    private void addDifferences(FeatureRow row, FeatureRow.Builder out) {
        out.put(GRID_QUALIFYING_DIFF, grid(row) - qualifying(row));
        out.put(TEMP_TRACK_AIR_DIFF,
                row.getOrDefault(AVG_TRACK_TEMP, 0.0) - row.getOrDefault(AVG_AIR_TEMP, 0.0));
        // Positive when the recent average is better (lower) than the career average
        out.put(MOMENTUM_POSITION, avgSoFar(row) - avgLast5(row));
    }

    // ============ INTERACTIONS ============

    private void addInteractions(FeatureRow row, FeatureRow.Builder out) {
        double grid = grid(row);
        out.put(GRID_QUALIFYING_INTERACTION, grid * qualifying(row));
        out.put(QUALIFYING_GAP_GRID_INTERACTION, qualifyingGap(row) * grid);
        out.put(HISTORICAL_GRID_INTERACTION, row.getOrDefault(CIRCUIT_WINS_HISTORY, 0.0) * grid);
        out.put(WIN_RATE_CONSTRUCTOR_INTERACTION,
                row.getOrDefault(WIN_RATE, 0.0) * row.getOrDefault(CONSTRUCTOR_WINS_SO_FAR, 0.0));
        out.put(POINTS_RECENT_FORM_INTERACTION,
                row.getOrDefault(POINTS_PER_RACE, 0.0) * (POSITION_INVERSION_BASE - avgLast5(row)));
    }

    // ============ COMPOSITES ============

    private void addComposites(FeatureRow row, FeatureRow.Builder out) {
        double wins = row.getOrDefault(WINS_SO_FAR, 0.0);
        double podiums = row.getOrDefault(PODIUMS_SO_FAR, 0.0);
        double winRate = row.getOrDefault(WIN_RATE, 0.0);
        double podiumRate = row.getOrDefault(PODIUM_RATE, 0.0);
        double pointsPerRace = row.getOrDefault(POINTS_PER_RACE, 0.0);

        out.put(WIN_PODIUM_RATIO, wins / (podiums + 1.0));
        out.put(MOMENTUM_SCORE, momentumWeights.score(avgLast5(row), pointsPerRace, winRate));
        out.put(POSITION_CONSISTENCY, Math.abs(avgSoFar(row) - avgLast5(row)));
        out.put(PERFORMANCE_INDEX, winRate * 0.4 + podiumRate * 0.3 + (pointsPerRace / WIN_POINTS) * 0.3);
        out.put(GRID_ADVANTAGE, (POSITION_INVERSION_BASE - grid(row)) / (double) GRID_POSITION_MAX);
        out.put(QUALIFYING_ADVANTAGE, (POSITION_INVERSION_BASE - qualifying(row)) / (double) GRID_POSITION_MAX);
        out.put(ESTIMATED_EXPERIENCE,
                row.getOrDefault(RACES_SO_FAR, 0.0) + row.getOrDefault(CIRCUIT_RACES_HISTORY, 0.0) * 2.0);
    }

    // ============ FIXED-VOCABULARY BUCKETS ============

    private void addBuckets(FeatureRow row, FeatureRow.Builder out) {
        oneHot(out, EXPERIENCE_LEVEL_PREFIX, EXPERIENCE_LEVELS, experienceLevel(row.getOrDefault(RACES_SO_FAR, 0.0)));
        oneHot(out, RAIN_CATEGORY_PREFIX, RAIN_CATEGORIES, rainCategory(row.getOrDefault(MAX_RAINFALL, 0.0)));
        oneHot(out, QUALIFYING_GAP_CATEGORY_PREFIX, QUALIFYING_GAP_CATEGORIES, qualifyingGapCategory(row));
    }

    private static void oneHot(FeatureRow.Builder out, String prefix, List<String> vocabulary, String value) {
        for (String candidate : vocabulary) {
            out.put(prefix + candidate, candidate.equals(value));
        }
    }

    static String experienceLevel(double racesSoFar) {
        if (racesSoFar <= ROOKIE_MAX_RACES) return "rookie";
        if (racesSoFar <= EXPERIENCED_MAX_RACES) return "experienced";
        return "veteran";
    }

    static String rainCategory(double maxRainfall) {
        if (maxRainfall <= DRY_MAX_RAINFALL) return "dry";
        if (maxRainfall <= LIGHT_MAX_RAINFALL) return "light";
        return "heavy";
    }

    private static String qualifyingGapCategory(FeatureRow row) {
        double gap = qualifyingGap(row);
        if (gap <= CLOSE_MAX_GAP_SECONDS) return "close";
        if (gap <= MEDIUM_MAX_GAP_SECONDS) return "medium";
        return "far";
    }

    // ============ HELPERS ============

    private static double grid(FeatureRow row) {
        return row.getOrDefault(GRID_POSITION, DEFAULT_AVG_POSITION);
    }

    private static double qualifying(FeatureRow row) {
        return row.getOrDefault(QUALIFYING_POSITION, grid(row));
    }

    private static double qualifyingGap(FeatureRow row) {
        return row.getOrDefault(QUALIFYING_TIME_FROM_POLE, UNKNOWN_QUALIFYING_GAP_SECONDS);
    }

    private static double avgSoFar(FeatureRow row) {
        return row.getOrDefault(AVG_POSITION_SO_FAR, DEFAULT_AVG_POSITION);
    }

    private static double avgLast5(FeatureRow row) {
        return row.getOrDefault(AVG_POSITION_LAST_5, DEFAULT_AVG_POSITION);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
