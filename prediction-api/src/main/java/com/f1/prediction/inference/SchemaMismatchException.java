package com.f1.prediction.inference;

/**
 * No aligned vector can be produced at all, e.g. the schema is empty.
 * Partial coverage is not an error and never raises this.
 */
public class SchemaMismatchException extends RuntimeException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
