package com.f1.prediction.feature;

import com.f1.prediction.model.EventRecord;

import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Cumulative and rolling statistics computed strictly from {@link HistoricalWindow} views.
 * Stateless and thread-safe.
 */
public class StatsAggregator {

    private final int recentFormWindow;

    public StatsAggregator() {
        this(FeatureConstants.RECENT_FORM_WINDOW);
    }

    public StatsAggregator(int recentFormWindow) {
        if (recentFormWindow < 1) {
            throw new IllegalArgumentException("Recent form window must be at least 1, got " + recentFormWindow);
        }
        this.recentFormWindow = recentFormWindow;
    }

    /**
     * Statistics for a driver at the target event.
     *
     * @param events      the historical table; may contain the target event and later ones
     * @param driverCode  driver to aggregate
     * @param constructor the driver's constructor at the target event (nullable)
     * @param circuitName the target event's circuit (nullable)
     */
    public DriverStats aggregate(Collection<EventRecord> events, String driverCode, String constructor,
                                 String circuitName, int targetSeason, int targetRound) {
        List<EventRecord> driverHistory = HistoricalWindow.window(events, driverCode, targetSeason, targetRound);
        List<EventRecord> constructorHistory =
                HistoricalWindow.forConstructor(events, constructor, targetSeason, targetRound);
        List<EventRecord> circuitHistory =
                HistoricalWindow.forCircuit(events, driverCode, circuitName, targetSeason, targetRound);

        int races = driverHistory.size();
        int wins = countWins(driverHistory);
        int podiums = (int) driverHistory.stream().filter(EventRecord::isPodium).count();
        double points = sumPoints(driverHistory);

        List<EventRecord> classified = driverHistory.stream()
                .filter(EventRecord::isClassified)
                .collect(Collectors.toList());
        double avgPosition = averagePosition(classified);
        List<EventRecord> recent = classified.subList(Math.max(0, classified.size() - recentFormWindow),
                classified.size());
        double avgPositionRecent = averagePosition(recent);

        int constructorEvents = (int) constructorHistory.stream()
                .map(e -> e.season() + ":" + e.round())
                .distinct()
                .count();

        List<EventRecord> circuitClassified = circuitHistory.stream()
                .filter(EventRecord::isClassified)
                .collect(Collectors.toList());

        return new DriverStats(
                wins,
                points,
                podiums,
                races,
                avgPosition,
                avgPositionRecent,
                perRace(points, races),
                perRace(wins, races),
                perRace(podiums, races),
                sumPoints(constructorHistory),
                countWins(constructorHistory),
                constructorEvents,
                countWins(circuitHistory),
                circuitHistory.size(),
                averagePosition(circuitClassified)
        );
    }

    private static int countWins(List<EventRecord> history) {
        return (int) history.stream().filter(EventRecord::winner).count();
    }

    private static double sumPoints(List<EventRecord> history) {
        return history.stream().mapToDouble(e -> Math.max(0.0, e.points())).sum();
    }

    // Zero-race histories yield 0 rather than a division by zero
    private static double perRace(double total, int races) {
        return races > 0 ? total / races : 0.0;
    }

    private static double averagePosition(List<EventRecord> classified) {
        OptionalDouble average = classified.stream()
                .mapToInt(EventRecord::finishingPosition)
                .average();
        return average.orElse(FeatureConstants.DEFAULT_AVG_POSITION);
    }
}
