package com.elssolution.tanksim.domain;

import java.util.List;

/** A validated, non-empty source ready for replay. Discarded on every stop/start cycle. */
public record LoadedSource(String id, List<Reading> readings, NormalizationRange range) {

    public LoadedSource {
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("source " + id + " has no readings");
        }
        readings = List.copyOf(readings);
    }

    public static LoadedSource of(String id, List<Reading> readings) {
        return new LoadedSource(id, readings, NormalizationRange.of(readings));
    }

    public int size() {
        return readings.size();
    }
}
