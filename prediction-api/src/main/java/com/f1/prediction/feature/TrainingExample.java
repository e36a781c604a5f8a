package com.f1.prediction.feature;

/**
 * One row of the training table: the features of a driver at an event and, kept apart,
 * the outcomes the models learn to predict.
 *
 * @param won               1 if the driver won, else 0
 * @param finishingPosition classified position, null when not classified
 * @param points            points scored at the event
 */
public record TrainingExample(
        int season,
        int round,
        String driverCode,
        FeatureRow features,
        int won,
        Integer finishingPosition,
        double points
) {
}
