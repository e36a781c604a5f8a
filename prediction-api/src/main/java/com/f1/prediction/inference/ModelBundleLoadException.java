package com.f1.prediction.inference;

/**
 * The model bundles could not be loaded completely. The engine must not serve in this state.
 */
public class ModelBundleLoadException extends RuntimeException {

    public ModelBundleLoadException(String message) {
        super(message);
    }

    public ModelBundleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
