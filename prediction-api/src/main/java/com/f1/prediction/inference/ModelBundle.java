package com.f1.prediction.inference;

import java.util.Objects;

/**
 * One trained model with the schema it was trained on. Never mutated after load.
 */
public final class ModelBundle {

    private final ModelRole role;
    private final RaceModel model;
    private final FeatureSchema schema;
    private final ModelMetadata metadata;

    public ModelBundle(ModelRole role, RaceModel model, FeatureSchema schema, ModelMetadata metadata) {
        this.role = Objects.requireNonNull(role, "role");
        this.model = Objects.requireNonNull(model, "model");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public ModelRole getRole() { return role; }
    public RaceModel getModel() { return model; }
    public FeatureSchema getSchema() { return schema; }
    public ModelMetadata getMetadata() { return metadata; }

    public String getVersion() {
        return metadata.version();
    }

    @Override
    public String toString() {
        return "ModelBundle{" + role + " v" + metadata.version() + ", " + schema + "}";
    }
}
