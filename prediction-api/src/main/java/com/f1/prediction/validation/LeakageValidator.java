package com.f1.prediction.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/**
 * Rejects feature sets that contain outcome-only fields.
 * <p>
 * A model trained on such features scores perfectly on history and fails in production,
 * so this check runs before any table is handed to training, on every loaded model schema,
 * and against the full feature catalog at startup.
 */
public class LeakageValidator {

    private static final Logger log = LoggerFactory.getLogger(LeakageValidator.class);

    private final ForbiddenFeatures forbidden;

    public LeakageValidator(ForbiddenFeatures forbidden) {
        this.forbidden = forbidden;
    }

    /**
     * @throws LeakageException if any candidate name is forbidden
     */
    public void validate(Collection<String> candidateFeatureNames) {
        validate(candidateFeatureNames, true);
    }

    /**
     * @param strict when false, a violation is logged instead of raised (diagnostics only)
     * @return the forbidden names found, empty when clean
     */
    public Set<String> validate(Collection<String> candidateFeatureNames, boolean strict) {
        Set<String> leaked = forbidden.intersect(candidateFeatureNames);
        if (leaked.isEmpty()) {
            log.debug("Leakage check passed for {} features", candidateFeatureNames.size());
            return leaked;
        }
        if (strict) {
            log.error("Data leakage detected: {} forbidden features {}", leaked.size(), leaked);
            throw new LeakageException(leaked);
        }
        log.warn("Data leakage detected (non-strict): {} forbidden features {}", leaked.size(), leaked);
        return leaked;
    }

    public ForbiddenFeatures getForbidden() {
        return forbidden;
    }
}
