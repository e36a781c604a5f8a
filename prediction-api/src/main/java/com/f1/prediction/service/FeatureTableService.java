package com.f1.prediction.service;

import com.f1.prediction.feature.FeatureTable;
import com.f1.prediction.feature.FeatureTableBuilder;
import com.f1.prediction.model.EventRecord;
import com.f1.prediction.model.readonly.RaceResultDocument;
import com.f1.prediction.repository.readonly.RaceResultReadRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds training feature tables from the stored race results.
 */
@Service
public class FeatureTableService {

    private final FeatureTableBuilder builder;
    private final RaceResultReadRepository raceResultRepository;

    public FeatureTableService(FeatureTableBuilder builder, RaceResultReadRepository raceResultRepository) {
        this.builder = builder;
        this.raceResultRepository = raceResultRepository;
    }

    /**
     * Rows for seasons {@code fromSeason..toSeason}; all earlier seasons are loaded as history.
     */
    public FeatureTable buildTable(int fromSeason, int toSeason, boolean strictRanges) {
        List<EventRecord> history = raceResultRepository.findUpToSeason(toSeason).stream()
                .map(RaceResultDocument::toEventRecord)
                .toList();
        return builder.build(history, fromSeason, toSeason, strictRanges);
    }

    /**
     * Table for a training run cut off before (cutoffSeason, cutoffRound).
     */
    public FeatureTable buildTableBefore(int fromSeason, int cutoffSeason, int cutoffRound, boolean strictRanges) {
        List<EventRecord> history = raceResultRepository.findBefore(cutoffSeason, cutoffRound).stream()
                .map(RaceResultDocument::toEventRecord)
                .toList();
        return builder.buildBefore(history, fromSeason, cutoffSeason, cutoffRound, strictRanges);
    }
}
