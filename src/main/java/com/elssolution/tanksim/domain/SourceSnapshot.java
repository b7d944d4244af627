package com.elssolution.tanksim.domain;

/** Immutable latest-known state of one source. */
public record SourceSnapshot(double level,
                             String timestamp,
                             long sequence,
                             int totalCount,
                             SourceStatus status) {

    public static SourceSnapshot running(ReplayEvent e) {
        return new SourceSnapshot(e.getLevel(), e.getTimestamp(), e.getSequence(), e.getTotalCount(),
                SourceStatus.RUNNING);
    }

    public SourceSnapshot withStatus(SourceStatus next) {
        return new SourceSnapshot(level, timestamp, sequence, totalCount, next);
    }
}
