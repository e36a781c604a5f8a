package com.f1.prediction.validation;

import java.util.Set;

/**
 * A candidate feature set contains race outcome fields.
 * Never recovered from: the pipeline run that raised it must stop.
 */
public class LeakageException extends RuntimeException {

    private final Set<String> leakedFeatures;

    public LeakageException(Set<String> leakedFeatures) {
        super("Data leakage detected: forbidden outcome features " + leakedFeatures
                + " must be removed before training or inference");
        this.leakedFeatures = Set.copyOf(leakedFeatures);
    }

    public Set<String> getLeakedFeatures() {
        return leakedFeatures;
    }
}
