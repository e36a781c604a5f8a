package com.f1.prediction.inference;

import java.util.Arrays;
import java.util.List;

/**
 * A feature row laid out in schema order, with the names that had to be zero-filled
 * and the row columns that the schema did not ask for.
 */
public record AlignedVector(double[] values, List<String> zeroFilled, List<String> dropped) {

    public AlignedVector {
        values = values.clone();
        zeroFilled = List.copyOf(zeroFilled);
        dropped = List.copyOf(dropped);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int length() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public boolean isComplete() {
        return zeroFilled.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignedVector)) return false;
        AlignedVector that = (AlignedVector) o;
        return Arrays.equals(values, that.values) && zeroFilled.equals(that.zeroFilled)
                && dropped.equals(that.dropped);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + zeroFilled.hashCode() * 17 + dropped.hashCode();
    }

    @Override
    public String toString() {
        return "AlignedVector" + Arrays.toString(values) + " zeroFilled=" + zeroFilled + " dropped=" + dropped;
    }
}
