package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.dto.TickResult;
import com.bbthechange.matchtracker.dto.TrackerStatus;
import com.bbthechange.matchtracker.dto.UpcomingMatchSummary;
import com.bbthechange.matchtracker.model.Subscription;

import java.util.List;

/**
 * Polling orchestrator for subscribed events.
 */
public interface MatchTrackerService {

    /**
     * Subscribe a group to an event, replacing any previous subscription of that group.
     * A re-subscribe by the same group resets the event's notified state.
     *
     * @param startDate first day of the event as MM-DD
     * @param endDate   last day of the event as MM-DD
     */
    Subscription subscribe(String groupId, String eventId, String title, String startDate, String endDate);

    /**
     * @return true if the group was subscribed
     */
    boolean unsubscribe(String groupId, String eventId);

    /**
     * Run one pass over all active events. Safe to call from any trigger; a call made while
     * another tick is running returns immediately with a skipped result.
     *
     * Process:
     * 1. Classify every subscribed event; pause polling and stop if none is active
     * 2. Fetch matches for each active event and collect live and next-match signals
     * 3. Send start notifications
     * 4. Fetch results for ongoing events and send complete ones
     * 5. Recompute the polling interval
     * 6. Refresh wake timers
     */
    TickResult tick();

    /**
     * Entry point of a wake timer: resume polling at the minimum interval and tick.
     */
    TickResult onWakeup(String eventId);

    /**
     * Not-started matches of all non-ended events, soonest first. Read-only.
     */
    List<UpcomingMatchSummary> getUpcomingSummary();

    TrackerStatus getStatus();

    /**
     * Startup work: baseline existing results, clean orphaned notified entries,
     * set the recurring trigger state and rebuild wake timers.
     */
    void initialize();
}
