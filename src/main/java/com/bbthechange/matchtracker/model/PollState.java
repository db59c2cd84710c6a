package com.bbthechange.matchtracker.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mutable signals gathered during a tick. Written only by the tick that holds the tick guard.
 */
@Data
@NoArgsConstructor
public class PollState {

    private int currentIntervalMinutes;
    private Integer nextMinutesHint;
    private boolean liveMatch;
    private Instant lastLiveSeenAt;
    private boolean fetchError;
    private boolean paused;

    public PollState(int currentIntervalMinutes) {
        this.currentIntervalMinutes = currentIntervalMinutes;
    }

    public PollState copy() {
        PollState copy = new PollState(currentIntervalMinutes);
        copy.setNextMinutesHint(nextMinutesHint);
        copy.setLiveMatch(liveMatch);
        copy.setLastLiveSeenAt(lastLiveSeenAt);
        copy.setFetchError(fetchError);
        copy.setPaused(paused);
        return copy;
    }
}
