package com.f1.prediction.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of outcome-only field names that must never be used as features.
 */
public final class ForbiddenFeatures {

    /**
     * Race outcome fields and anything derived directly from them.
     */
    public static final ForbiddenFeatures DEFAULT = of(
            // Race results
            "race_position",
            "final_position",
            "position",
            "points",
            "dnf",
            "winner",
            "fastest_lap_time",
            "fastest_lap_rank",
            "race_time",
            "time_retired",
            "laps_completed",
            "status",
            // Derived from the result
            "podium",
            "points_scored",
            "finished",
            "classified"
    );

    private final Set<String> names;

    private ForbiddenFeatures(Set<String> names) {
        this.names = Collections.unmodifiableSet(new TreeSet<>(names));
    }

    public static ForbiddenFeatures of(String... names) {
        return of(Set.of(names));
    }

    public static ForbiddenFeatures of(Collection<String> names) {
        return new ForbiddenFeatures(new TreeSet<>(names));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * Forbidden names present in the candidate set, sorted.
     */
    public Set<String> intersect(Collection<String> candidates) {
        TreeSet<String> found = new TreeSet<>();
        for (String candidate : candidates) {
            if (candidate != null && names.contains(candidate)) {
                found.add(candidate);
            }
        }
        return Collections.unmodifiableSet(found);
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return "ForbiddenFeatures" + names;
    }
}
