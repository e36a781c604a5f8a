package com.f1.prediction.dto;

import com.f1.prediction.feature.FeatureTable;
import com.f1.prediction.feature.TrainingExample;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Training table export. Targets are returned beside, never inside, the feature map.
 */
public record FeatureTableResponse(
        int fromSeason,
        int toSeason,
        String encodingScheme,
        Set<String> featureNames,
        List<String> dataQualityIssues,
        List<Row> rows
) {

    public record Row(
            int season,
            int round,
            String driverCode,
            Map<String, Double> features,
            int won,
            Integer finishingPosition,
            double points
    ) {
        static Row of(TrainingExample example) {
            return new Row(example.season(), example.round(), example.driverCode(), example.features().asMap(),
                    example.won(), example.finishingPosition(), example.points());
        }
    }

    public static FeatureTableResponse of(int fromSeason, int toSeason, FeatureTable table) {
        return new FeatureTableResponse(fromSeason, toSeason, table.getEncodingScheme(), table.getFeatureNames(),
                table.getDataQualityIssues(), table.getExamples().stream().map(Row::of).toList());
    }
}
