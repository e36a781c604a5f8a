package com.f1.prediction.validation;

import com.f1.prediction.feature.FeatureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.f1.prediction.feature.FeatureCatalog.*;

/**
 * Plausibility ranges for features, catching corrupt input before it reaches a model.
 */
public class FeatureRangeValidator {

    private static final Logger log = LoggerFactory.getLogger(FeatureRangeValidator.class);

    record Range(double min, double max, String unit) {
        boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    static final Map<String, Range> RANGES;
    static {
        Map<String, Range> ranges = new LinkedHashMap<>();
        ranges.put(GRID_POSITION, new Range(1, 20, ""));
        ranges.put(QUALIFYING_POSITION, new Range(1, 20, ""));
        ranges.put(AVG_AIR_TEMP, new Range(-10, 60, "°C"));
        ranges.put(AVG_TRACK_TEMP, new Range(-10, 60, "°C"));
        ranges.put(WIN_RATE, new Range(0, 1, ""));
        RANGES = ranges;
    }

    /**
     * @param strict when false, problems are logged and returned instead of raised
     * @return the problems found
     * @throws DataQualityException in strict mode when any value is out of range
     */
    public List<String> validate(Collection<FeatureRow> rows, boolean strict) {
        List<String> issues = new ArrayList<>();

        for (Map.Entry<String, Range> entry : RANGES.entrySet()) {
            String feature = entry.getKey();
            Range range = entry.getValue();
            int invalid = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (FeatureRow row : rows) {
                if (!row.contains(feature)) continue;
                double value = row.getOrDefault(feature, 0.0);
                min = Math.min(min, value);
                max = Math.max(max, value);
                if (!range.contains(value)) invalid++;
            }
            if (invalid > 0) {
                issues.add(String.format("%s: %d values out of range [%s, %s]%s. Min: %s, Max: %s",
                        feature, invalid, fmt(range.min()), fmt(range.max()), range.unit(), fmt(min), fmt(max)));
            }
        }

        report(issues, strict);
        return issues;
    }

    /**
     * @throws DataQualityException if any required feature is absent from the given names
     */
    public void requireFeatures(Set<String> present, Collection<String> required) {
        List<String> missing = required.stream()
                .filter(name -> !present.contains(name))
                .sorted()
                .toList();
        if (!missing.isEmpty()) {
            log.error("Missing {} required features: {}", missing.size(), missing);
            throw new DataQualityException("Missing required features", missing);
        }
        log.debug("Required features validated: all {} present", required.size());
    }

    private void report(List<String> issues, boolean strict) {
        if (issues.isEmpty()) {
            log.debug("Feature ranges validated: all values within expected ranges");
            return;
        }
        if (strict) {
            log.error("Data quality issues detected: {}", issues);
            throw new DataQualityException("Feature values out of range", issues);
        }
        log.warn("Data quality issues detected (non-strict): {}", issues);
    }

    private static String fmt(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
