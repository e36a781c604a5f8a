package com.f1.prediction.repository.readonly;

import com.f1.prediction.model.readonly.RaceResultDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only repository for race results.
 * Note: Write operations will fail with MongoDB authorization error.
 */
@Repository
public interface RaceResultReadRepository extends MongoRepository<RaceResultDocument, String> {

    List<RaceResultDocument> findBySeasonBetween(int fromSeason, int toSeason);

    /**
     * Everything strictly before (season, round): the history available for that event.
     */
    @Query("{ $or: [ { 'season': { $lt: ?0 } }, { 'season': ?0, 'round': { $lt: ?1 } } ] }")
    List<RaceResultDocument> findBefore(int season, int round);

    @Query("{ 'season': { $lte: ?0 } }")
    List<RaceResultDocument> findUpToSeason(int season);
}
