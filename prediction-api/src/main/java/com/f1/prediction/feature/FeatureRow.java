package com.f1.prediction.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Ordered mapping from feature name to value for one driver at one target event.
 * Immutable; every value is finite.
 */
public final class FeatureRow {

    private static final FeatureRow EMPTY = new FeatureRow(new LinkedHashMap<>());

    private final Map<String, Double> values;

    private FeatureRow(LinkedHashMap<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FeatureRow empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder(new LinkedHashMap<>());
    }

    public static FeatureRow of(Map<String, Double> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder(new LinkedHashMap<>(values));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public OptionalDouble get(String name) {
        Double value = values.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double getOrDefault(String name, double defaultValue) {
        Double value = values.get(name);
        return value == null ? defaultValue : value;
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureRow)) return false;
        return values.equals(((FeatureRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureRow" + values;
    }

    public static final class Builder {

        private final LinkedHashMap<String, Double> values;

        private Builder(LinkedHashMap<String, Double> values) {
            this.values = values;
        }

        /**
         * @throws IllegalArgumentException if the value is NaN or infinite
         */
        public Builder put(String name, double value) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Feature '" + name + "' is not finite: " + value);
            }
            values.put(name, value);
            return this;
        }

        public Builder put(String name, boolean flag) {
            return put(name, flag ? 1.0 : 0.0);
        }

        /** Puts the value if present, otherwise the fallback. */
        public Builder putOrDefault(String name, Double value, double fallback) {
            return put(name, value != null && Double.isFinite(value) ? value : fallback);
        }

        public Builder putAll(FeatureRow other) {
            other.values.forEach(this::put);
            return this;
        }

        public FeatureRow build() {
            return new FeatureRow(new LinkedHashMap<>(values));
        }
    }
}
