package com.f1.prediction.controller;

import com.f1.prediction.dto.RacePredictionRequest;
import com.f1.prediction.model.RacePrediction;
import com.f1.prediction.service.RacePredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/predictions")
@Tag(name = "Predictions", description = "Race prediction endpoints")
public class PredictionController {

    private final RacePredictionService predictionService;

    public PredictionController(RacePredictionService predictionService) {
        this.predictionService = predictionService;
    }

    // ============ PREDICTIONS ============

    @PostMapping("/race")
    @Operation(summary = "Predict a race", description = "Predict win probability, finishing position and points for every driver of the posted field")
    public RacePrediction predictRace(
            @RequestBody RacePredictionRequest request,
            @RequestParam(defaultValue = "true") boolean store
    ) {
        return predictionService.predict(request, store);
    }

    @GetMapping("/race/{season}/{round}")
    @Operation(summary = "Get stored race prediction", description = "Most recent stored prediction for an event")
    public RacePrediction getRacePrediction(@PathVariable int season, @PathVariable int round) {
        return predictionService.getPrediction(season, round);
    }

    @GetMapping("/season/{season}")
    @Operation(summary = "Get season predictions", description = "All stored predictions of a season, by round")
    public List<RacePrediction> getSeasonPredictions(@PathVariable int season) {
        return predictionService.getSeasonPredictions(season);
    }
}
