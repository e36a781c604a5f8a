package com.f1.prediction.controller;

import com.f1.prediction.dto.FeatureCatalogResponse;
import com.f1.prediction.dto.FeatureTableResponse;
import com.f1.prediction.feature.FeatureCatalog;
import com.f1.prediction.feature.FeatureConstants;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.feature.FeatureTable;
import com.f1.prediction.service.FeatureTableService;
import com.f1.prediction.validation.LeakageValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/features")
@Tag(name = "Features", description = "Feature catalog and training table export")
public class FeatureController {

    private final FeatureTableService featureTableService;
    private final FeaturePipeline featurePipeline;
    private final LeakageValidator leakageValidator;

    public FeatureController(
            FeatureTableService featureTableService,
            FeaturePipeline featurePipeline,
            LeakageValidator leakageValidator
    ) {
        this.featureTableService = featureTableService;
        this.featurePipeline = featurePipeline;
        this.leakageValidator = leakageValidator;
    }

    @GetMapping("/catalog")
    @Operation(summary = "Feature catalog", description = "Every feature the pipeline produces, the forbidden outcome fields and the encoding scheme")
    public FeatureCatalogResponse catalog() {
        return new FeatureCatalogResponse(
                FeatureCatalog.names(),
                leakageValidator.getForbidden().names(),
                featurePipeline.encodingScheme(),
                FeatureConstants.RECENT_FORM_WINDOW);
    }

    @GetMapping("/table")
    @Operation(summary = "Training feature table", description = "Leakage-checked feature rows with targets for the season range; pass cutoffRound to stop before that round of toSeason")
    public FeatureTableResponse table(
            @RequestParam int fromSeason,
            @RequestParam int toSeason,
            @RequestParam(required = false) Integer cutoffRound,
            @RequestParam(defaultValue = "false") boolean strict
    ) {
        FeatureTable table = cutoffRound != null
                ? featureTableService.buildTableBefore(fromSeason, toSeason, cutoffRound, strict)
                : featureTableService.buildTable(fromSeason, toSeason, strict);
        return FeatureTableResponse.of(fromSeason, toSeason, table);
    }
}
