package com.f1.prediction.validation;

import java.util.List;

/**
 * Temporal, range or completeness problems in a feature table.
 */
public class DataQualityException extends RuntimeException {

    private final List<String> issues;

    public DataQualityException(String summary, List<String> issues) {
        super(summary + ": " + String.join("; ", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
