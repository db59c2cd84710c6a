package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.model.MapScore;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds notification titles and bodies for match starts and results.
 */
@Component
public class NotificationTextGenerator {

    public static final String MATCH_STARTING_TITLE = "Match Starting";
    public static final String MATCH_RESULT_TITLE = "Match Result";

    private static final String UNKNOWN_TEAM = "TBD";

    /**
     * Body for a match start, e.g. "Vitality vs NAVI (BO3) is starting at IEM Cologne".
     */
    public String getMatchStartingBody(Match match, String eventTitle) {
        String teams = String.format("%s vs %s", teamName(match.getTeamA()), teamName(match.getTeamB()));
        String format = match.getMapsFormat();
        if (format != null && !format.isBlank()) {
            teams = String.format("%s (%s)", teams, format.trim().toUpperCase());
        }
        if (eventTitle != null && !eventTitle.isBlank()) {
            return String.format("%s is starting at %s", teams, eventTitle);
        }
        return String.format("%s is starting", teams);
    }

    /**
     * Body for a finished match, with per-map scores when available.
     */
    public String getMatchResultBody(MatchResult result, String eventTitle) {
        StringBuilder body = new StringBuilder(String.format("%s %d-%d %s",
                teamName(result.getTeamA()), result.getScoreA(), result.getScoreB(), teamName(result.getTeamB())));

        List<String> maps = new ArrayList<>();
        if (result.getMapScores() != null) {
            for (MapScore map : result.getMapScores()) {
                if (map.isScored()) {
                    maps.add(String.format("%s %d-%d", map.getMapName(), map.getScoreA(), map.getScoreB()));
                }
            }
        }
        if (!maps.isEmpty()) {
            body.append(" (").append(String.join(", ", maps)).append(")");
        }

        String winner = result.getWinner();
        if (winner != null) {
            body.append(". ").append(teamName(winner)).append(" wins");
        }
        if (eventTitle != null && !eventTitle.isBlank()) {
            body.append(" at ").append(eventTitle);
        }
        return body.toString();
    }

    private static String teamName(String team) {
        return team == null || team.isBlank() ? UNKNOWN_TEAM : team;
    }
}
