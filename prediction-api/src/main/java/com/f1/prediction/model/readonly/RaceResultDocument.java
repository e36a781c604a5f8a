package com.f1.prediction.model.readonly;

import com.f1.prediction.model.EventRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Read-only model for per-driver race results from the data-collection service.
 * This service cannot write to this collection.
 */
@Document(collection = "race_results")
public class RaceResultDocument {

    @Id
    private String id;

    private int season;
    private int round;
    private String eventName;
    private String circuitName;
    private String country;
    private Double circuitLength;

    private String driverCode;
    private Integer driverNumber;
    private String constructor;

    // Qualifying
    private Integer gridPosition;
    private Integer qualifyingPosition;
    private Double q1Time;
    private Double q2Time;
    private Double q3Time;
    private Double qualifyingBestTime;

    // Weather
    private Double avgAirTemp;
    private Double avgTrackTemp;
    private Double avgHumidity;
    private Double avgWindSpeed;
    private Double maxRainfall;
    private Boolean hadRain;

    // Outcome
    private Integer finishingPosition;
    private Double points;
    private Boolean dnf;
    private Boolean winner;
    private String status;
    private Double fastestLapTime;

    private Instant updatedAt;

    // Getters only (read-only)
    public String getId() { return id; }
    public int getSeason() { return season; }
    public int getRound() { return round; }
    public String getEventName() { return eventName; }
    public String getCircuitName() { return circuitName; }
    public String getCountry() { return country; }
    public Double getCircuitLength() { return circuitLength; }
    public String getDriverCode() { return driverCode; }
    public Integer getDriverNumber() { return driverNumber; }
    public String getConstructor() { return constructor; }
    public Integer getGridPosition() { return gridPosition; }
    public Integer getQualifyingPosition() { return qualifyingPosition; }
    public Double getQ1Time() { return q1Time; }
    public Double getQ2Time() { return q2Time; }
    public Double getQ3Time() { return q3Time; }
    public Double getQualifyingBestTime() { return qualifyingBestTime; }
    public Double getAvgAirTemp() { return avgAirTemp; }
    public Double getAvgTrackTemp() { return avgTrackTemp; }
    public Double getAvgHumidity() { return avgHumidity; }
    public Double getAvgWindSpeed() { return avgWindSpeed; }
    public Double getMaxRainfall() { return maxRainfall; }
    public Boolean getHadRain() { return hadRain; }
    public Integer getFinishingPosition() { return finishingPosition; }
    public Double getPoints() { return points; }
    public Boolean getDnf() { return dnf; }
    public Boolean getWinner() { return winner; }
    public String getStatus() { return status; }
    public Double getFastestLapTime() { return fastestLapTime; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Converts to the pipeline's record. A missing winner flag is derived from position 1,
     * a missing DNF flag from the absence of a finishing position.
     */
    public EventRecord toEventRecord() {
        boolean isDnf = dnf != null ? dnf : finishingPosition == null;
        boolean isWinner = winner != null ? winner : Integer.valueOf(1).equals(finishingPosition);
        return new EventRecord(season, round, driverCode, driverNumber, constructor, circuitName, country,
                eventName, circuitLength, gridPosition, qualifyingPosition, q1Time, q2Time, q3Time,
                qualifyingBestTime, avgAirTemp, avgTrackTemp, avgHumidity, avgWindSpeed, maxRainfall, hadRain,
                finishingPosition, points != null ? points : 0.0, isDnf, isWinner, status, fastestLapTime);
    }
}
