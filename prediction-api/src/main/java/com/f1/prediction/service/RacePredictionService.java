package com.f1.prediction.service;

import com.f1.prediction.dto.RacePredictionRequest;
import com.f1.prediction.exception.ResourceNotFoundException;
import com.f1.prediction.inference.PredictionEngine;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.PreRaceAttributes;
import com.f1.prediction.model.RacePrediction;
import com.f1.prediction.model.RacePredictionDocument;
import com.f1.prediction.model.readonly.RaceResultDocument;
import com.f1.prediction.repository.RacePredictionRepository;
import com.f1.prediction.repository.readonly.RaceResultReadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for generating and storing race predictions.
 */
@Service
public class RacePredictionService {

    private static final Logger log = LoggerFactory.getLogger(RacePredictionService.class);

    private final ModelRegistry modelRegistry;
    private final RaceResultReadRepository raceResultRepository;
    private final RacePredictionRepository predictionRepository;

    public RacePredictionService(
            ModelRegistry modelRegistry,
            RaceResultReadRepository raceResultRepository,
            RacePredictionRepository predictionRepository
    ) {
        this.modelRegistry = modelRegistry;
        this.raceResultRepository = raceResultRepository;
        this.predictionRepository = predictionRepository;
    }

    // ============ PREDICT ============

    /**
     * Predicts the posted field using only results strictly before the event.
     *
     * @param store whether to persist the prediction, replacing any earlier one from the same model version
     */
    public RacePrediction predict(RacePredictionRequest request, boolean store) {
        List<PreRaceAttributes> field = request.toField();
        PredictionEngine engine = modelRegistry.requireEngine();

        List<EventRecord> history = loadHistory(request.season(), request.round());
        RacePrediction prediction = engine.predict(history, request.season(), request.round(), field);

        if (store) {
            save(prediction);
        }
        return prediction;
    }

    // ============ STORED PREDICTIONS ============

    /**
     * Most recent stored prediction for the event.
     */
    public RacePrediction getPrediction(int season, int round) {
        return predictionRepository.findBySeasonAndRoundOrderByGeneratedAtDesc(season, round).stream()
                .findFirst()
                .map(RacePredictionDocument::toRacePrediction)
                .orElseThrow(() -> new ResourceNotFoundException("Race prediction", season + "/" + round));
    }

    public List<RacePrediction> getSeasonPredictions(int season) {
        return predictionRepository.findBySeasonOrderByRoundAsc(season).stream()
                .map(RacePredictionDocument::toRacePrediction)
                .toList();
    }

    List<EventRecord> loadHistory(int season, int round) {
        List<EventRecord> history = raceResultRepository.findBefore(season, round).stream()
                .map(RaceResultDocument::toEventRecord)
                .toList();
        if (history.isEmpty()) {
            log.warn("No race history before {}/{}; every driver gets default statistics", season, round);
        }
        return history;
    }

    private void save(RacePrediction prediction) {
        RacePredictionDocument doc = predictionRepository
                .findBySeasonAndRoundAndModelVersion(prediction.season(), prediction.round(), prediction.modelVersion())
                .orElseGet(RacePredictionDocument::new);
        doc.apply(prediction);
        predictionRepository.save(doc);
        log.info("Stored prediction for {}/{} ({} drivers, model {})", prediction.season(), prediction.round(),
                prediction.results().size(), prediction.modelVersion());
    }
}
