package com.f1.prediction.inference;

/**
 * A fitted model scoring one aligned feature vector.
 * Implementations must be immutable after construction so they can be shared across threads.
 */
@FunctionalInterface
public interface RaceModel {

    /**
     * @param features values in the order of the bundle's {@link FeatureSchema}
     * @return the raw, unclipped prediction (a probability for classifiers)
     */
    double predict(double[] features);
}
