package com.elssolution.tanksim.loader;

import lombok.Getter;

/** One source could not be loaded or validated. */
@Getter
public class SourceLoadException extends Exception {

    private final String sourceId;
    private final String reason;

    public SourceLoadException(String sourceId, String reason) {
        super(sourceId + ": " + reason);
        this.sourceId = sourceId;
        this.reason = reason;
    }

    public SourceLoadException(String sourceId, String reason, Throwable cause) {
        super(sourceId + ": " + reason, cause);
        this.sourceId = sourceId;
        this.reason = reason;
    }
}
