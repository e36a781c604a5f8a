package com.f1.prediction.inference;

import com.f1.prediction.Fixtures;
import com.f1.prediction.feature.CategoricalEncoder;
import com.f1.prediction.feature.FeaturePipeline;
import com.f1.prediction.feature.FeatureTransformer;
import com.f1.prediction.feature.StatsAggregator;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.model.PredictionResult;
import com.f1.prediction.model.RacePrediction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.f1.prediction.Fixtures.result;
import static com.f1.prediction.feature.FeatureCatalog.GRID_POSITION;
import static com.f1.prediction.feature.FeatureCatalog.WINS_SO_FAR;
import static org.junit.jupiter.api.Assertions.*;

class PredictionEngineTests {

    FeaturePipeline pipeline;
    Clock clock;

    private final List<PreRaceAttributes> field = List.of(
            Fixtures.attributes(2024, 12, "NOR", "McLaren", 2, 86.9),
            Fixtures.attributes(2024, 12, "VER", "Red Bull Racing", 1, 86.7),
            Fixtures.attributes(2024, 12, "HAM", "Mercedes", 3, 87.1)
    );

    @BeforeEach
    void setUp() {
        pipeline = new FeaturePipeline(new StatsAggregator(), new FeatureTransformer(), new CategoricalEncoder());
        clock = Clock.fixed(Instant.parse("2024-07-06T15:00:00Z"), ZoneId.of("UTC"));
    }

    private static ModelBundle bundle(ModelRole role, RaceModel model, String... features) {
        return new ModelBundle(role, model, FeatureSchema.of(features), new ModelMetadata("1.0.0", Map.of()));
    }

    /** Win: logistic(2 - grid). Position: grid. Points: 30 - grid. */
    private static ModelBundleSet gridBundles() {
        return ModelBundleSet.of("1.0.0", List.of(
                bundle(ModelRole.WIN_CLASSIFIER,
                        new LinearRaceModel(2.0, new double[]{-1.0}, LinearRaceModel.Link.LOGISTIC), GRID_POSITION),
                bundle(ModelRole.POSITION_REGRESSOR,
                        new LinearRaceModel(0.0, new double[]{1.0}, LinearRaceModel.Link.IDENTITY), GRID_POSITION),
                bundle(ModelRole.POINTS_REGRESSOR,
                        new LinearRaceModel(30.0, new double[]{-1.0}, LinearRaceModel.Link.IDENTITY), GRID_POSITION)
        ));
    }

    private PredictionEngine engine(ModelBundleSet bundles) {
        return new PredictionEngine(pipeline, new SchemaAligner(), new OutputClipper(),
                new PreRaceAttributeValidator(), bundles, clock);
    }

    @Test
    void oneResultPerDriver_sortedByPredictedPosition() {
        RacePrediction prediction = engine(gridBundles()).predict(List.of(), 2024, 12, field);

        assertEquals(List.of("VER", "NOR", "HAM"),
                prediction.results().stream().map(PredictionResult::driverCode).toList());
        assertEquals(2024, prediction.season());
        assertEquals(12, prediction.round());
        assertEquals("British Grand Prix", prediction.eventName());
        assertEquals("1.0.0", prediction.modelVersion());
        assertEquals(Instant.parse("2024-07-06T15:00:00Z"), prediction.generatedAt());
    }

    @Test
    void outputs_areClippedToTheirDomains() {
        RacePrediction prediction = engine(gridBundles()).predict(List.of(), 2024, 12, field);

        PredictionResult pole = prediction.results().get(0);
        assertEquals(26.0, pole.predictedPoints());
        assertEquals(1.0, pole.predictedPosition());
        assertEquals(1.0 / (1.0 + Math.exp(-1.0)), pole.winProbability(), 1e-12);
        assertTrue(pole.predictedWinner());

        for (PredictionResult r : prediction.results()) {
            assertTrue(r.winProbability() >= 0.0 && r.winProbability() <= 1.0);
            assertTrue(r.predictedPosition() >= 1.0 && r.predictedPosition() <= field.size());
            assertTrue(r.predictedPoints() >= 0.0 && r.predictedPoints() <= 26.0);
        }
    }

    @Test
    void winnerFlag_requiresProbabilityAboveOneHalf() {
        RacePrediction prediction = engine(gridBundles()).predict(List.of(), 2024, 12, field);

        // grid 2 scores exactly 0.5
        PredictionResult second = prediction.results().get(1);
        assertEquals(0.5, second.winProbability(), 1e-12);
        assertFalse(second.predictedWinner());
    }

    @Test
    void malformedDriver_isDefaulted_withoutAffectingTheOthers() {
        List<PreRaceAttributes> withBadGrid = new ArrayList<>(field);
        withBadGrid.add(Fixtures.attributes(2024, 12, "SAR", "Williams", 40, 88.9));

        RacePrediction prediction = engine(gridBundles()).predict(List.of(), 2024, 12, withBadGrid);

        PredictionResult sargeant = prediction.results().stream()
                .filter(r -> "SAR".equals(r.driverCode())).findFirst().orElseThrow();
        assertTrue(sargeant.defaulted());
        assertNull(sargeant.gridPosition());
        assertEquals(4.0, sargeant.predictedPosition());
        assertEquals(4, prediction.results().size());
        assertTrue(prediction.results().stream()
                .filter(r -> !"SAR".equals(r.driverCode()))
                .noneMatch(PredictionResult::defaulted));
    }

    @Test
    void absurdLapTime_isDefaulted_withoutAbortingTheField() {
        List<PreRaceAttributes> withBadTime = List.of(
                Fixtures.attributes(2024, 12, "VER", "Red Bull Racing", 1, 86.7),
                Fixtures.attributes(2024, 12, "BAD", "Haas F1 Team", 2, Double.MAX_VALUE));

        RacePrediction prediction = engine(gridBundles()).predict(List.of(), 2024, 12, withBadTime);

        assertEquals(2, prediction.results().size());
        assertTrue(prediction.results().get(1).defaulted());
        assertEquals("BAD", prediction.results().get(1).driverCode());
        assertFalse(prediction.results().get(0).defaulted());
    }

    @Test
    void failureForOneDriver_isRetriedWithDefaults() {
        RaceModel failsOnGridTwo = features -> {
            if (features[0] == 2.0) {
                throw new IllegalStateException("cannot score grid 2");
            }
            return features[0];
        };
        ModelBundleSet bundles = ModelBundleSet.of("1.2.0", List.of(
                bundle(ModelRole.WIN_CLASSIFIER,
                        new LinearRaceModel(2.0, new double[]{-1.0}, LinearRaceModel.Link.LOGISTIC), GRID_POSITION),
                bundle(ModelRole.POSITION_REGRESSOR, failsOnGridTwo, GRID_POSITION),
                bundle(ModelRole.POINTS_REGRESSOR,
                        new LinearRaceModel(30.0, new double[]{-1.0}, LinearRaceModel.Link.IDENTITY), GRID_POSITION)
        ));

        RacePrediction prediction = engine(bundles).predict(List.of(), 2024, 12, field);

        assertEquals(3, prediction.results().size());
        PredictionResult norris = prediction.results().stream()
                .filter(r -> "NOR".equals(r.driverCode())).findFirst().orElseThrow();
        assertTrue(norris.defaulted());
        assertNull(norris.gridPosition());
        assertEquals(3.0, norris.predictedPosition());
        assertTrue(prediction.results().stream()
                .filter(r -> !"NOR".equals(r.driverCode()))
                .noneMatch(PredictionResult::defaulted));
    }

    @Test
    void nonFiniteModelOutput_fallsBackToNeutralValues() {
        RaceModel broken = features -> Double.NaN;
        ModelBundleSet bundles = ModelBundleSet.of("0.9.0", List.of(
                bundle(ModelRole.WIN_CLASSIFIER, broken, GRID_POSITION),
                bundle(ModelRole.POSITION_REGRESSOR, broken, GRID_POSITION),
                bundle(ModelRole.POINTS_REGRESSOR, broken, GRID_POSITION)
        ));

        RacePrediction prediction = engine(bundles).predict(List.of(), 2024, 12, field);

        for (PredictionResult r : prediction.results()) {
            assertEquals(1.0 / 3, r.winProbability(), 1e-12);
            assertEquals(2.0, r.predictedPosition());
            assertEquals(0.0, r.predictedPoints());
        }
    }

    @Test
    void schemaMismatch_doesNotAbortPrediction() {
        ModelBundleSet bundles = ModelBundleSet.of("1.1.0", List.of(
                bundle(ModelRole.WIN_CLASSIFIER,
                        new LinearRaceModel(0.0, new double[]{1.0, 1.0}, LinearRaceModel.Link.LOGISTIC),
                        GRID_POSITION, "sector_1_pace"),
                bundle(ModelRole.POSITION_REGRESSOR,
                        new LinearRaceModel(0.0, new double[]{1.0}, LinearRaceModel.Link.IDENTITY), "sector_1_pace"),
                bundle(ModelRole.POINTS_REGRESSOR,
                        new LinearRaceModel(5.0, new double[]{1.0}, LinearRaceModel.Link.IDENTITY), "sector_1_pace")
        ));

        RacePrediction prediction = engine(bundles).predict(List.of(), 2024, 12, field);

        assertEquals(3, prediction.results().size());
        assertTrue(prediction.results().stream().allMatch(r -> r.predictedPosition() == 1.0));
        assertTrue(prediction.results().stream().allMatch(r -> r.predictedPoints() == 5.0));
    }

    @Test
    void futureResults_doNotChangePredictions() {
        ModelBundleSet bundles = ModelBundleSet.of("1.0.0", List.of(
                bundle(ModelRole.WIN_CLASSIFIER,
                        new LinearRaceModel(-1.0, new double[]{0.5}, LinearRaceModel.Link.LOGISTIC), WINS_SO_FAR),
                bundle(ModelRole.POSITION_REGRESSOR,
                        new LinearRaceModel(10.0, new double[]{-1.0}, LinearRaceModel.Link.IDENTITY), WINS_SO_FAR),
                bundle(ModelRole.POINTS_REGRESSOR,
                        new LinearRaceModel(5.0, new double[]{2.0}, LinearRaceModel.Link.IDENTITY), WINS_SO_FAR)
        ));
        List<EventRecord> history = new ArrayList<>(List.of(result(2024, 11, "VER", "Red Bull Racing", 1, 25)));

        RacePrediction before = engine(bundles).predict(history, 2024, 12, field);
        history.add(result(2024, 12, "HAM", "Mercedes", 1, 25));
        history.add(result(2024, 13, "HAM", "Mercedes", 1, 25));
        RacePrediction after = engine(bundles).predict(history, 2024, 12, field);

        assertEquals(before.results(), after.results());
    }

    @Test
    void emptyField_isRejected() {
        PredictionEngine engine = engine(gridBundles());

        assertThrows(IllegalArgumentException.class, () -> engine.predict(List.of(), 2024, 12, List.of()));
    }
}
