package com.elssolution.tanksim.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/** One (timestamp, raw value) sample of a source. */
public record Reading(LocalDateTime timestamp, double value) implements Comparable<Reading> {

    public Reading {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public int compareTo(Reading o) {
        return timestamp.compareTo(o.timestamp);
    }
}
