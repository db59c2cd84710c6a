package com.bbthechange.matchtracker.dto.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Match entry of GET /events/{eventId}/matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedMatchResponse {

    private String id;

    @JsonProperty("team1")
    private String teamA;

    @JsonProperty("team2")
    private String teamB;

    /**
     * Match day as MM-DD.
     */
    private String date;

    /**
     * Start time as HH:MM, or "LIVE" while running.
     */
    private String time;

    /**
     * Start time in epoch milliseconds when upstream exposes it. Takes precedence over date/time.
     */
    private Long unixTime;

    private Boolean live;

    /**
     * Teams or slot not decided yet.
     */
    private Boolean tbd;

    /**
     * e.g. "bo1", "bo3".
     */
    private String format;
}
