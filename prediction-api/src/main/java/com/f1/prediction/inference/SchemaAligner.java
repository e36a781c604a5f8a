package com.f1.prediction.inference;

import com.f1.prediction.feature.FeatureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles a feature row with the ordered feature list a model was trained on.
 * <p>
 * Schema names missing from the row are filled with 0 and reported; row columns the schema
 * does not know are dropped. The output always has exactly {@code schema.size()} entries.
 */
public class SchemaAligner {

    private static final Logger log = LoggerFactory.getLogger(SchemaAligner.class);

    public static final double DEFAULT_VALUE = 0.0;

    /**
     * @throws SchemaMismatchException if the schema is null or empty
     */
    public AlignedVector align(FeatureRow row, FeatureSchema schema) {
        if (schema == null || schema.isEmpty()) {
            throw new SchemaMismatchException("Cannot align features against an empty schema");
        }

        List<String> names = schema.getFeatureNames();
        double[] values = new double[names.size()];
        List<String> zeroFilled = new ArrayList<>();

        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (row.contains(name)) {
                values[i] = row.getOrDefault(name, DEFAULT_VALUE);
            } else {
                values[i] = DEFAULT_VALUE;
                zeroFilled.add(name);
            }
        }

        Set<String> expected = new HashSet<>(names);
        List<String> dropped = row.names().stream()
                .filter(name -> !expected.contains(name))
                .toList();

        if (!zeroFilled.isEmpty()) {
            log.warn("Schema mismatch: {} of {} features missing, filled with {}: {}",
                    zeroFilled.size(), names.size(), DEFAULT_VALUE, zeroFilled);
        }
        if (!dropped.isEmpty()) {
            log.info("Schema mismatch: dropped {} features not in schema: {}", dropped.size(), dropped);
        }

        return new AlignedVector(values, zeroFilled, dropped);
    }
}
