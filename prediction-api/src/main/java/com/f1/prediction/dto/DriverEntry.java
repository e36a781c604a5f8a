package com.f1.prediction.dto;

/**
 * One starter of the event to predict, as known after qualifying.
 */
public record DriverEntry(
        String driverCode,
        Integer driverNumber,
        String constructor,
        Integer gridPosition,
        Integer qualifyingPosition,
        Double q1Time,
        Double q2Time,
        Double q3Time,
        Double qualifyingBestTime
) {
}
