package com.bbthechange.matchtracker.dto.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result entry of GET /events/{eventId}/results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedResultResponse {

    private String id;

    @JsonProperty("team1")
    private String teamA;

    @JsonProperty("team2")
    private String teamB;

    @JsonProperty("score1")
    private Integer scoreA;

    @JsonProperty("score2")
    private Integer scoreB;

    private List<FeedMapResponse> maps;
}
