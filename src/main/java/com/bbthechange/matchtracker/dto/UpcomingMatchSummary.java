package com.bbthechange.matchtracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A not-yet-started match, as listed by the upcoming summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpcomingMatchSummary {

    private String eventId;
    private String eventTitle;
    private String matchId;
    private String teamA;
    private String teamB;
    private String mapsFormat;

    /**
     * Null when upstream hides the time.
     */
    private Instant scheduledTime;

    private Long minutesUntilStart;
}
