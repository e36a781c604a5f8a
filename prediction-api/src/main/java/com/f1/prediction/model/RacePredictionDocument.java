package com.f1.prediction.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Stores race predictions, one document per event and model version.
 * This service has full read/write access to this collection.
 */
@Document(collection = "race_predictions")
@CompoundIndex(name = "event_model_idx", def = "{'season': 1, 'round': 1, 'modelVersion': 1}", unique = true)
public class RacePredictionDocument {

    @Id
    private String id;

    @Indexed
    private int season;
    private int round;
    private String eventName;
    private String circuitName;

    @Indexed
    private String modelVersion;

    private List<PredictionResult> results;
    private String predictedWinner;      // driver code, null when nobody clears 0.5

    // Metadata
    private Instant generatedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public RacePredictionDocument() {
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public static RacePredictionDocument from(RacePrediction prediction) {
        RacePredictionDocument doc = new RacePredictionDocument();
        doc.apply(prediction);
        return doc;
    }

    /**
     * Overwrites the prediction content, keeping id and creation time.
     */
    public void apply(RacePrediction prediction) {
        this.season = prediction.season();
        this.round = prediction.round();
        this.eventName = prediction.eventName();
        this.circuitName = prediction.circuitName();
        this.modelVersion = prediction.modelVersion();
        this.results = prediction.results();
        this.generatedAt = prediction.generatedAt();
        this.predictedWinner = prediction.results().stream()
                .filter(PredictionResult::predictedWinner)
                .map(PredictionResult::driverCode)
                .findFirst()
                .orElse(null);
        this.updatedAt = Instant.now();
    }

    public RacePrediction toRacePrediction() {
        return new RacePrediction(season, round, eventName, circuitName, modelVersion, generatedAt, results);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public int getSeason() { return season; }
    public void setSeason(int season) { this.season = season; }

    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }

    public String getEventName() { return eventName; }
    public void setEventName(String eventName) { this.eventName = eventName; }

    public String getCircuitName() { return circuitName; }
    public void setCircuitName(String circuitName) { this.circuitName = circuitName; }

    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }

    public List<PredictionResult> getResults() { return results; }
    public void setResults(List<PredictionResult> results) { this.results = results; }

    public String getPredictedWinner() { return predictedWinner; }
    public void setPredictedWinner(String predictedWinner) { this.predictedWinner = predictedWinner; }

    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
