package com.f1.prediction.repository;

import com.f1.prediction.model.RacePredictionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Full read/write repository for race predictions.
 */
@Repository
public interface RacePredictionRepository extends MongoRepository<RacePredictionDocument, String> {

    Optional<RacePredictionDocument> findBySeasonAndRoundAndModelVersion(int season, int round, String modelVersion);

    List<RacePredictionDocument> findBySeasonAndRoundOrderByGeneratedAtDesc(int season, int round);

    List<RacePredictionDocument> findBySeasonOrderByRoundAsc(int season);
}
