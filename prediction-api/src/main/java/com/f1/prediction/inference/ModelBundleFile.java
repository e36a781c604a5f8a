package com.f1.prediction.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * On-disk form of one bundle, as exported by the training side.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelBundleFile(
        ModelRole role,
        String version,
        String encodingScheme,
        List<String> features,
        Map<String, Double> metrics,
        ModelSpec model
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelSpec(
            String type,
            LinearRaceModel.Link link,
            Double intercept,
            double[] coefficients
    ) {}
}
