package com.elssolution.tanksim.domain;

/**
 * Lifecycle of one source's snapshot: IDLE → RUNNING → {STOPPED | ERROR}.
 * STOPPED and ERROR are terminal until the next start clears the cache.
 */
public enum SourceStatus {
    IDLE, RUNNING, STOPPED, ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == ERROR;
    }

    /** True if a snapshot in this state may be replaced by one in {@code next}. */
    public boolean canMoveTo(SourceStatus next) {
        if (isTerminal()) return false;
        if (this == RUNNING) return next != IDLE;
        return true;
    }
}
