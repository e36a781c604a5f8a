package com.f1.prediction.dto;

import java.time.Instant;
import java.util.List;

/**
 * Standardized error response format.
 */
public record ApiError(
        String code,
        String message,
        String path,
        List<String> details,
        Instant timestamp
) {
    public ApiError(String code, String message, String path) {
        this(code, message, path, List.of(), Instant.now());
    }

    public ApiError(String code, String message, String path, List<String> details) {
        this(code, message, path, details, Instant.now());
    }
}
