package com.elssolution.tanksim.loader;

import com.elssolution.tanksim.domain.Reading;

import java.util.List;

/**
 * Turns a source reference into its ordered readings.
 * Range computation and level derivation are the caller's job.
 */
public interface SourceLoader {

    /** Stable identifier of the source behind {@code ref}. */
    String sourceId(String ref);

    /**
     * @return readings sorted by timestamp, never empty
     * @throws SourceLoadException if the source is missing, unreadable or has no usable rows
     */
    List<Reading> load(String ref) throws SourceLoadException;
}
