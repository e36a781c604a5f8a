package com.f1.prediction.service;

import com.f1.prediction.dto.DriverEntry;
import com.f1.prediction.dto.RacePredictionRequest;
import com.f1.prediction.exception.PredictionUnavailableException;
import com.f1.prediction.exception.ResourceNotFoundException;
import com.f1.prediction.inference.PredictionEngine;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.model.PredictionResult;
import com.f1.prediction.model.RacePrediction;
import com.f1.prediction.model.RacePredictionDocument;
import com.f1.prediction.repository.RacePredictionRepository;
import com.f1.prediction.repository.readonly.RaceResultReadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RacePredictionServiceTests {

    ModelRegistry registry;
    RaceResultReadRepository raceResults;
    RacePredictionRepository predictions;
    PredictionEngine engine;

    RacePredictionService service;

    private final RacePredictionRequest request = new RacePredictionRequest(2024, 8, "Monaco Grand Prix", "Monaco",
            "Monaco", 3.337, 22.0, 41.0, 60.0, 1.2, 0.0, false,
            List.of(new DriverEntry("LEC", 16, "Ferrari", 1, 1, 71.2, 70.8, 70.27, 70.27),
                    new DriverEntry("PIA", 81, "McLaren", 2, 2, 71.3, 70.9, 70.42, 70.42)));

    private final RacePrediction prediction = new RacePrediction(2024, 8, "Monaco Grand Prix", "Monaco", "1.2.0",
            Instant.parse("2024-05-25T16:00:00Z"), List.of(
            new PredictionResult("LEC", 16, "Ferrari", 1, 0.62, 1.4, 22.0, false, true),
            new PredictionResult("PIA", 81, "McLaren", 2, 0.21, 2.3, 17.5, false, false)));

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistry.class);
        raceResults = mock(RaceResultReadRepository.class);
        predictions = mock(RacePredictionRepository.class);
        engine = mock(PredictionEngine.class);
        service = new RacePredictionService(registry, raceResults, predictions);
    }

    @Test
    void predict_usesHistoryBeforeEvent_andStoresResult() {
        when(registry.requireEngine()).thenReturn(engine);
        when(raceResults.findBefore(2024, 8)).thenReturn(List.of());
        when(engine.predict(anyList(), eq(2024), eq(8), anyList())).thenReturn(prediction);
        when(predictions.findBySeasonAndRoundAndModelVersion(2024, 8, "1.2.0")).thenReturn(Optional.empty());

        RacePrediction result = service.predict(request, true);

        assertSame(prediction, result);
        verify(raceResults).findBefore(2024, 8);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PreRaceAttributes>> field = ArgumentCaptor.forClass(List.class);
        verify(engine).predict(anyList(), eq(2024), eq(8), field.capture());
        assertEquals(2, field.getValue().size());
        assertEquals("Monaco", field.getValue().get(0).circuitName());
        assertEquals(70.27, field.getValue().get(0).qualifyingBestTime());

        ArgumentCaptor<RacePredictionDocument> saved = ArgumentCaptor.forClass(RacePredictionDocument.class);
        verify(predictions).save(saved.capture());
        assertEquals("LEC", saved.getValue().getPredictedWinner());
        assertEquals("1.2.0", saved.getValue().getModelVersion());
    }

    @Test
    void predict_withoutStore_doesNotWrite() {
        when(registry.requireEngine()).thenReturn(engine);
        when(raceResults.findBefore(anyInt(), anyInt())).thenReturn(List.of());
        when(engine.predict(anyList(), anyInt(), anyInt(), anyList())).thenReturn(prediction);

        service.predict(request, false);

        verify(predictions, never()).save(any());
    }

    @Test
    void predict_replacesEarlierPredictionOfSameModelVersion() {
        RacePredictionDocument existing = new RacePredictionDocument();
        existing.setId("abc");
        when(registry.requireEngine()).thenReturn(engine);
        when(raceResults.findBefore(anyInt(), anyInt())).thenReturn(List.of());
        when(engine.predict(anyList(), anyInt(), anyInt(), anyList())).thenReturn(prediction);
        when(predictions.findBySeasonAndRoundAndModelVersion(2024, 8, "1.2.0")).thenReturn(Optional.of(existing));

        service.predict(request, true);

        verify(predictions).save(existing);
        assertEquals("abc", existing.getId());
        assertEquals(2, existing.getResults().size());
    }

    @Test
    void predict_withoutModels_isUnavailable() {
        when(registry.requireEngine()).thenThrow(new PredictionUnavailableException("Prediction models are not loaded"));

        assertThrows(PredictionUnavailableException.class, () -> service.predict(request, true));
        verifyNoInteractions(raceResults, predictions);
    }

    @Test
    void invalidRequest_isRejectedBeforeLoadingHistory() {
        RacePredictionRequest noDrivers = new RacePredictionRequest(2024, 8, null, null, null, null,
                null, null, null, null, null, null, List.of());

        assertThrows(IllegalArgumentException.class, () -> service.predict(noDrivers, true));
        verifyNoInteractions(raceResults, registry);
    }

    @Test
    void storedPrediction_isReturned_orNotFound() {
        when(predictions.findBySeasonAndRoundOrderByGeneratedAtDesc(2024, 8))
                .thenReturn(List.of(RacePredictionDocument.from(prediction)));
        when(predictions.findBySeasonAndRoundOrderByGeneratedAtDesc(2024, 9)).thenReturn(List.of());

        assertEquals(prediction, service.getPrediction(2024, 8));
        assertThrows(ResourceNotFoundException.class, () -> service.getPrediction(2024, 9));
    }
}
