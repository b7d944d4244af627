package com.elssolution.tanksim.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One published reading, annotated with its normalized value and per-source progress. */
@Value
@Builder
@Jacksonized
public class ReplayEvent {
    String sourceId;
    String timestamp;     // yyyy-MM-dd HH:mm:ss
    double rawValue;
    double normalized;    // always in [0,1]
    double level;         // normalized * level scale, 3 decimals
    long sequence;        // strictly increasing per source, starts at 1 on every start
    int totalCount;       // number of readings the source replays
}
