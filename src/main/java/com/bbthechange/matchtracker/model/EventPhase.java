package com.bbthechange.matchtracker.model;

/**
 * Lifecycle phase of a tracked event, derived from its date range at a given instant.
 * Never stored.
 */
public enum EventPhase {
    ONGOING,
    UPCOMING,
    NOT_ONGOING,
    ENDED,
    /**
     * Dates missing or unparsable. The event is neither polled nor woken.
     */
    UNKNOWN;

    /**
     * Whether the event should be polled on the periodic tick.
     */
    public boolean isActive() {
        return this == ONGOING || this == UPCOMING;
    }
}
