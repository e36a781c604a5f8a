package com.f1.prediction.feature;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Training feature table in chronological order. Built only by {@link FeatureTableBuilder},
 * which has already checked it for leakage.
 */
public final class FeatureTable {

    private final List<TrainingExample> examples;
    private final Set<String> featureNames;
    private final String encodingScheme;
    private final List<String> dataQualityIssues;

    FeatureTable(List<TrainingExample> examples, String encodingScheme, List<String> dataQualityIssues) {
        this.examples = List.copyOf(examples);
        Set<String> names = new LinkedHashSet<>();
        for (TrainingExample example : examples) {
            names.addAll(example.features().names());
        }
        this.featureNames = Collections.unmodifiableSet(names);
        this.encodingScheme = encodingScheme;
        this.dataQualityIssues = List.copyOf(dataQualityIssues);
    }

    FeatureTable withDataQualityIssues(List<String> issues) {
        return new FeatureTable(examples, encodingScheme, issues);
    }

    public List<TrainingExample> getExamples() {
        return examples;
    }

    /** Union of the feature names across all rows, in first-seen order. */
    public Set<String> getFeatureNames() {
        return featureNames;
    }

    public String getEncodingScheme() {
        return encodingScheme;
    }

    /** Range problems found in lenient mode; empty when the table is clean. */
    public List<String> getDataQualityIssues() {
        return dataQualityIssues;
    }

    public List<FeatureRow> rows() {
        return examples.stream().map(TrainingExample::features).toList();
    }

    public int size() {
        return examples.size();
    }

    public boolean isEmpty() {
        return examples.isEmpty();
    }
}
