package com.bbthechange.matchtracker.client;

import com.bbthechange.matchtracker.exception.MatchFeedException;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;

import java.util.List;

/**
 * Upstream source of matches and results for an event.
 * An empty list means upstream has nothing; failures are thrown.
 */
public interface MatchDataSource {

    List<Match> fetchMatches(String eventId) throws MatchFeedException;

    List<MatchResult> fetchResults(String eventId) throws MatchFeedException;
}
