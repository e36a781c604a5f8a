package com.f1.prediction.inference;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * The three models served together.
 */
public enum ModelRole {

    WIN_CLASSIFIER("win_classifier.json"),
    POSITION_REGRESSOR("position_regressor.json"),
    POINTS_REGRESSOR("points_regressor.json");

    private final String fileName;

    ModelRole(String fileName) {
        this.fileName = fileName;
    }

    @JsonCreator
    public static ModelRole fromJson(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** File holding this role's bundle inside a version directory. */
    public String getFileName() {
        return fileName;
    }
}
