package com.f1.prediction.inference;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The classifier and both regressors, complete or not at all.
 */
public final class ModelBundleSet {

    private final String version;
    private final Map<ModelRole, ModelBundle> bundles;

    private ModelBundleSet(String version, Map<ModelRole, ModelBundle> bundles) {
        this.version = version;
        this.bundles = Collections.unmodifiableMap(bundles);
    }

    /**
     * @throws ModelBundleLoadException unless there is exactly one bundle per role
     */
    public static ModelBundleSet of(String version, Collection<ModelBundle> bundles) {
        EnumMap<ModelRole, ModelBundle> byRole = new EnumMap<>(ModelRole.class);
        for (ModelBundle bundle : bundles) {
            if (byRole.put(bundle.getRole(), bundle) != null) {
                throw new ModelBundleLoadException("Duplicate bundle for role " + bundle.getRole());
            }
        }
        for (ModelRole role : ModelRole.values()) {
            if (!byRole.containsKey(role)) {
                throw new ModelBundleLoadException("Missing bundle for role " + role);
            }
        }
        return new ModelBundleSet(version, byRole);
    }

    public ModelBundle get(ModelRole role) {
        return bundles.get(role);
    }

    public Collection<ModelBundle> all() {
        return bundles.values();
    }

    public String getVersion() {
        return version;
    }
}
