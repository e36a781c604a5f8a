package com.f1.prediction.feature;

/**
 * Weights of the momentum score:
 * {@code recentForm * (21 - avg_position_last_5) + pointsPerRace * points_per_race + winRate * win_rate}.
 * <p>
 * The weights are part of the feature definition; a model must be used with the weights it was trained with.
 */
public record MomentumWeights(double recentForm, double pointsPerRace, double winRate) {

    public static final MomentumWeights DEFAULT = new MomentumWeights(1.0, 1.0, 10.0);

    public MomentumWeights {
        if (!Double.isFinite(recentForm) || !Double.isFinite(pointsPerRace) || !Double.isFinite(winRate)) {
            throw new IllegalArgumentException("Momentum weights must be finite");
        }
    }

    public double score(double avgPositionLast5, double pointsPerRaceValue, double winRateValue) {
        return recentForm * (FeatureConstants.POSITION_INVERSION_BASE - avgPositionLast5)
                + pointsPerRace * pointsPerRaceValue
                + winRate * winRateValue;
    }
}
