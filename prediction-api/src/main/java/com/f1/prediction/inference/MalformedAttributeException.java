package com.f1.prediction.inference;

import java.util.List;

/**
 * One driver's pre-race attributes are missing or implausible.
 * Recoverable: the driver's row is built from defaults and the rest of the field is unaffected.
 */
public class MalformedAttributeException extends RuntimeException {

    private final String driverCode;
    private final List<String> problems;

    public MalformedAttributeException(String driverCode, List<String> problems) {
        super("Malformed pre-race attributes for driver " + driverCode + ": " + String.join("; ", problems));
        this.driverCode = driverCode;
        this.problems = List.copyOf(problems);
    }

    public String getDriverCode() {
        return driverCode;
    }

    public List<String> getProblems() {
        return problems;
    }
}
