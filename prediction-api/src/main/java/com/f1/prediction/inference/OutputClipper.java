package com.f1.prediction.inference;

import com.f1.prediction.feature.FeatureConstants;

/**
 * Constrains raw model outputs to the valid domain of each quantity.
 * Clipping is idempotent and monotonic: in-range values pass through unchanged.
 */
public class OutputClipper {

    public double clipProbability(double raw) {
        return clip(raw, 0.0, 1.0);
    }

    /**
     * @param fieldSize number of starters; positions are clipped to [1, fieldSize]
     */
    public double clipPosition(double raw, int fieldSize) {
        return clip(raw, 1.0, Math.max(1, fieldSize));
    }

    public double clipPoints(double raw) {
        return clip(raw, 0.0, FeatureConstants.MAX_POINTS_PER_EVENT);
    }

    /**
     * @throws IllegalArgumentException if the value is NaN; callers decide the fallback
     */
    public static double clip(double value, double min, double max) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Cannot clip NaN");
        }
        return Math.max(min, Math.min(max, value));
    }
}
