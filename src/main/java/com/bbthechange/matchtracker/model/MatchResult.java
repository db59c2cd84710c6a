package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A finished match as reported by the match feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    // Series scores never exceed this; anything above is a single map's round score.
    private static final int MAX_SERIES_SCORE = 3;

    private String id;
    private String teamA;
    private String teamB;
    private int scoreA;
    private int scoreB;

    @Builder.Default
    private List<MapScore> mapScores = new ArrayList<>();

    @Builder.Default
    private List<MapDetail> mapDetails = new ArrayList<>();

    /**
     * Number of maps the aggregate score implies were played.
     */
    public int expectedMapCount() {
        if (scoreA <= MAX_SERIES_SCORE && scoreB <= MAX_SERIES_SCORE) {
            return Math.max(1, scoreA + scoreB);
        }
        return 1;
    }

    /**
     * True once per-map scores and per-map detail records are present for every expected map.
     */
    public boolean isComplete() {
        int expected = expectedMapCount();

        Set<String> scoredMaps = new HashSet<>();
        if (mapScores != null) {
            for (MapScore score : mapScores) {
                if (score != null && score.isScored() && score.getMapName() != null) {
                    scoredMaps.add(score.getMapName());
                }
            }
        }
        if (scoredMaps.size() < expected) {
            return false;
        }

        Set<String> detailedMaps = new HashSet<>();
        if (mapDetails != null) {
            for (MapDetail detail : mapDetails) {
                if (detail != null && detail.getMapName() != null && scoredMaps.contains(detail.getMapName())) {
                    detailedMaps.add(detail.getMapName());
                }
            }
        }
        return detailedMaps.size() >= expected;
    }

    public String getWinner() {
        if (scoreA == scoreB) {
            return null;
        }
        return scoreA > scoreB ? teamA : teamB;
    }
}
