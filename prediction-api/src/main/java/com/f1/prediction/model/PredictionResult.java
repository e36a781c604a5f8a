package com.f1.prediction.model;

/**
 * One driver's clipped predictions for a target event.
 *
 * @param winProbability    probability of winning, in [0, 1]
 * @param predictedPosition expected finishing position, in [1, field size]
 * @param predictedPoints   expected points, in [0, 26]
 * @param defaulted         true if malformed attributes were replaced by defaults
 * @param predictedWinner   true if the win probability exceeds one half
 */
public record PredictionResult(
        String driverCode,
        Integer driverNumber,
        String constructor,
        Integer gridPosition,
        double winProbability,
        double predictedPosition,
        double predictedPoints,
        boolean defaulted,
        boolean predictedWinner
) {
}
