package com.f1.prediction.inference;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;

/**
 * Linear model exported from training as intercept plus coefficients,
 * optionally passed through the logistic function (classifiers).
 */
public final class LinearRaceModel implements RaceModel {

    public enum Link {
        IDENTITY,
        LOGISTIC;

        @JsonCreator
        public static Link fromJson(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final double intercept;
    private final double[] coefficients;
    private final Link link;

    public LinearRaceModel(double intercept, double[] coefficients, Link link) {
        if (coefficients == null || coefficients.length == 0) {
            throw new IllegalArgumentException("Linear model needs at least one coefficient");
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Linear model coefficients must be finite");
            }
        }
        if (!Double.isFinite(intercept)) {
            throw new IllegalArgumentException("Linear model intercept must be finite");
        }
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
        this.link = link != null ? link : Link.IDENTITY;
    }

    @Override
    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length + " features, got " + features.length);
        }
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * features[i];
        }
        return link == Link.LOGISTIC ? 1.0 / (1.0 + Math.exp(-z)) : z;
    }

    public Link getLink() {
        return link;
    }

    @Override
    public String toString() {
        return "LinearRaceModel{link=" + link + ", intercept=" + intercept
                + ", coefficients=" + Arrays.toString(coefficients) + "}";
    }
}
