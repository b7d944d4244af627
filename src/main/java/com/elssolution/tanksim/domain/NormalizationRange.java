package com.elssolution.tanksim.domain;

import java.util.List;

/**
 * Per-source (min, max) computed once at load time.
 * A flat series (max == min) gets range 1 so every value maps to 0.
 * {@code range} may be infinite for extreme finite values; normalization then works on halves.
 */
public record NormalizationRange(double min, double max, double range) {

    public static NormalizationRange of(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("cannot compute a range over zero readings");
        }
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (Reading r : readings) {
            lo = Math.min(lo, r.value());
            hi = Math.max(hi, r.value());
        }
        double range = (hi == lo) ? 1.0 : hi - lo;
        return new NormalizationRange(lo, hi, range);
    }

    /** Maps a raw value into [0,1]. Values outside the load-time range are clamped. */
    public double normalize(double raw) {
        double n = Double.isInfinite(range)
                ? (raw / 2 - min / 2) / (max / 2 - min / 2) // max - min overflows, halves do not
                : (raw - min) / range;
        if (Double.isNaN(n) || n < 0.0) return 0.0;
        return Math.min(n, 1.0);
    }
}
