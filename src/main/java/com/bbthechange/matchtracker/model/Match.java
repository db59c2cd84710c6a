package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A scheduled or running match as reported by the match feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Match {

    private String id;
    private String teamA;
    private String teamB;

    /**
     * Upstream explicitly flags the match as running.
     */
    private boolean live;

    /**
     * Null when upstream did not give a resolvable time.
     */
    private Instant scheduledTime;

    /**
     * Series format as shown upstream, e.g. "bo3".
     */
    private String mapsFormat;

    /**
     * Upstream flags the match as to be decided (teams or slot not fixed yet).
     */
    private boolean tbd;

    public boolean hasScheduledTime() {
        return scheduledTime != null;
    }
}
