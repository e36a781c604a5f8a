package com.f1.prediction.dto;

import java.util.List;
import java.util.Set;

public record FeatureCatalogResponse(
        List<String> features,
        Set<String> forbidden,
        String encodingScheme,
        int recentFormWindow
) {
}
