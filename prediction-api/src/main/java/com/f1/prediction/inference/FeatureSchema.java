package com.f1.prediction.inference;

import com.f1.prediction.feature.CategoricalEncoder;

import java.util.List;
import java.util.Objects;

/**
 * Ordered feature names a trained model expects, together with the categorical
 * encoding scheme its training data was produced with. Immutable.
 */
public final class FeatureSchema {

    private final List<String> featureNames;
    private final String encodingScheme;

    public FeatureSchema(List<String> featureNames, String encodingScheme) {
        this.featureNames = List.copyOf(featureNames);
        this.encodingScheme = encodingScheme != null ? encodingScheme : CategoricalEncoder.SCHEME;
    }

    public static FeatureSchema of(String... featureNames) {
        return new FeatureSchema(List.of(featureNames), CategoricalEncoder.SCHEME);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public String getEncodingScheme() {
        return encodingScheme;
    }

    public int size() {
        return featureNames.size();
    }

    public boolean isEmpty() {
        return featureNames.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSchema)) return false;
        FeatureSchema that = (FeatureSchema) o;
        return featureNames.equals(that.featureNames) && encodingScheme.equals(that.encodingScheme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(featureNames, encodingScheme);
    }

    @Override
    public String toString() {
        return "FeatureSchema{" + featureNames.size() + " features, encoding=" + encodingScheme + "}";
    }
}
