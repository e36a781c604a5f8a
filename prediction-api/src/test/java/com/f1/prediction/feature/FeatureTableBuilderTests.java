package com.f1.prediction.feature;

import com.f1.prediction.inference.PreRaceAttributeValidator;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.validation.DataQualityException;
import com.f1.prediction.validation.FeatureRangeValidator;
import com.f1.prediction.validation.ForbiddenFeatures;
import com.f1.prediction.validation.LeakageException;
import com.f1.prediction.validation.LeakageValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.f1.prediction.Fixtures.result;
import static com.f1.prediction.feature.FeatureCatalog.*;
import static org.junit.jupiter.api.Assertions.*;

class FeatureTableBuilderTests {

    FeaturePipeline pipeline;
    LeakageValidator leakageValidator;
    FeatureTableBuilder builder;

    private final List<EventRecord> history = List.of(
            result(2023, 1, "HAM", "Mercedes", 1, 25),
            result(2023, 1, "VER", "Red Bull Racing", 2, 18),
            result(2023, 2, "HAM", "Mercedes", null, 0),
            result(2023, 2, "VER", "Red Bull Racing", 1, 25),
            result(2024, 1, "VER", "Red Bull Racing", 1, 25)
    );

    @BeforeEach
    void setUp() {
        pipeline = new FeaturePipeline(new StatsAggregator(), new FeatureTransformer(), new CategoricalEncoder());
        leakageValidator = new LeakageValidator(ForbiddenFeatures.DEFAULT);
        builder = new FeatureTableBuilder(pipeline, leakageValidator, new FeatureRangeValidator(),
                new PreRaceAttributeValidator());
    }

    @Test
    void oneRowPerDriverAndEvent_inChronologicalOrder() {
        FeatureTable table = builder.build(history, 2023, 2023, false);

        assertEquals(4, table.size());
        assertEquals(List.of(1, 1, 2, 2), table.getExamples().stream().map(TrainingExample::round).toList());
        assertEquals(CategoricalEncoder.SCHEME, table.getEncodingScheme());
        assertTrue(table.getDataQualityIssues().isEmpty());
    }

    @Test
    void eachRow_onlySeesEarlierEvents() {
        FeatureTable table = builder.build(history, 2023, 2024, false);

        TrainingExample hamRound1 = find(table, 2023, 1, "HAM");
        TrainingExample hamRound2 = find(table, 2023, 2, "HAM");
        TrainingExample verRound3 = find(table, 2024, 1, "VER");

        assertEquals(0.0, hamRound1.features().getOrDefault(RACES_SO_FAR, -1));
        assertEquals(1.0, hamRound2.features().getOrDefault(WINS_SO_FAR, -1));
        assertEquals(1.0, hamRound2.features().getOrDefault(RACES_SO_FAR, -1));
        assertEquals(1.0, verRound3.features().getOrDefault(WINS_SO_FAR, -1));
        assertEquals(43.0, verRound3.features().getOrDefault(POINTS_SO_FAR, -1));
    }

    @Test
    void targets_areKeptOutOfTheFeatures() {
        FeatureTable table = builder.build(history, 2023, 2023, false);

        TrainingExample winner = find(table, 2023, 1, "HAM");
        TrainingExample retired = find(table, 2023, 2, "HAM");

        assertEquals(1, winner.won());
        assertEquals(1, winner.finishingPosition());
        assertEquals(25.0, winner.points());
        assertNull(retired.finishingPosition());
        assertEquals(0, retired.won());
        assertTrue(ForbiddenFeatures.DEFAULT.intersect(table.getFeatureNames()).isEmpty());
    }

    @Test
    void leakingTransform_failsTheWholeTable() {
        FeatureTransformer leaky = new FeatureTransformer() {
            @Override
            public FeatureRow transform(FeatureRow row) {
                return super.transform(row).toBuilder().put("race_position", 1).build();
            }
        };
        FeatureTableBuilder leakyBuilder = new FeatureTableBuilder(
                new FeaturePipeline(new StatsAggregator(), leaky, new CategoricalEncoder()),
                leakageValidator, new FeatureRangeValidator(), new PreRaceAttributeValidator());

        LeakageException e = assertThrows(LeakageException.class,
                () -> leakyBuilder.build(history, 2023, 2023, false));
        assertTrue(e.getLeakedFeatures().contains("race_position"));
    }

    @Test
    void buildBefore_rejectsHistoryReachingTheCutoff() {
        assertThrows(DataQualityException.class, () -> builder.buildBefore(history, 2023, 2024, 1, false));

        FeatureTable table = builder.buildBefore(history.subList(0, 4), 2023, 2024, 1, false);
        assertEquals(4, table.size());
    }

    @Test
    void outOfRangeGrid_isReportedOrRaised() {
        List<EventRecord> withBadGrid = List.of(result(2023, 1, "HAM", "Mercedes", 24, 0));

        FeatureTable lenient = builder.build(withBadGrid, 2023, 2023, false);
        assertFalse(lenient.getDataQualityIssues().isEmpty());
        assertTrue(lenient.getDataQualityIssues().get(0).startsWith(GRID_POSITION));

        assertThrows(DataQualityException.class, () -> builder.build(withBadGrid, 2023, 2023, true));
    }

    @Test
    void implausibleAttributes_areFeaturizedTheSameWayAsAtInference() {
        // Pit-lane start recorded as grid 0, plus an impossible air temperature
        EventRecord pitLaneStart = new EventRecord(2023, 2, "VER", 1, "Red Bull Racing", "Silverstone",
                "United Kingdom", "British Grand Prix", 5.891, 0, 12, 90.1, 89.5, 88.9, 88.9,
                70.0, 35.0, 55.0, 3.0, 0.0, false,
                3, 15.0, false, false, "Finished", 91.2);
        List<EventRecord> records = List.of(history.get(0), history.get(1), pitLaneStart);

        FeatureTable table = builder.build(records, 2023, 2023, false);

        PreRaceAttributes atInference = new PreRaceAttributeValidator().sanitize(pitLaneStart.preRace());
        FeatureRow inferenceRow = pipeline.build(records, atInference, 2023, 2,
                FeaturePipeline.poleTime(List.of(atInference)));
        FeatureRow trainingRow = find(table, 2023, 2, "VER").features();

        assertEquals(inferenceRow, trainingRow);
        assertEquals(12.0, trainingRow.getOrDefault(GRID_POSITION, -1));
    }

    @Test
    void invertedSeasonRange_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(history, 2024, 2023, false));
    }

    private static TrainingExample find(FeatureTable table, int season, int round, String driver) {
        return table.getExamples().stream()
                .filter(e -> e.season() == season && e.round() == round && driver.equals(e.driverCode()))
                .findFirst()
                .orElseThrow();
    }
}
