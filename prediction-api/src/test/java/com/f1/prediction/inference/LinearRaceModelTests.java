package com.f1.prediction.inference;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearRaceModelTests {

    @Test
    void identityLink_isInterceptPlusDotProduct() {
        LinearRaceModel model = new LinearRaceModel(1.5, new double[]{2.0, -1.0}, LinearRaceModel.Link.IDENTITY);

        assertEquals(1.5 + 6.0 - 4.0, model.predict(new double[]{3.0, 4.0}), 1e-12);
    }

    @Test
    void logisticLink_mapsToProbability() {
        LinearRaceModel model = new LinearRaceModel(0.0, new double[]{1.0}, LinearRaceModel.Link.LOGISTIC);

        assertEquals(0.5, model.predict(new double[]{0.0}), 1e-12);
        assertTrue(model.predict(new double[]{50.0}) <= 1.0);
    }

    @Test
    void wrongFeatureCount_isRejected() {
        LinearRaceModel model = new LinearRaceModel(0.0, new double[]{1.0, 2.0}, null);

        assertEquals(LinearRaceModel.Link.IDENTITY, model.getLink());
        assertThrows(IllegalArgumentException.class, () -> model.predict(new double[]{1.0}));
    }

    @Test
    void nonFiniteCoefficients_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new LinearRaceModel(0.0, new double[]{Double.NaN}, LinearRaceModel.Link.IDENTITY));
        assertThrows(IllegalArgumentException.class,
                () -> new LinearRaceModel(0.0, new double[0], LinearRaceModel.Link.IDENTITY));
    }

    @Test
    void linkNames_parseCaseInsensitively() {
        assertEquals(LinearRaceModel.Link.LOGISTIC, LinearRaceModel.Link.fromJson(" logistic "));
        assertEquals(ModelRole.POINTS_REGRESSOR, ModelRole.fromJson("points_regressor"));
    }
}
