package com.bbthechange.matchtracker.dto.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedMapResponse {

    private String name;

    @JsonProperty("score1")
    private Integer scoreA;

    @JsonProperty("score2")
    private Integer scoreB;

    /**
     * Id of the per-map stats page, null until published.
     */
    private String statsId;
}
