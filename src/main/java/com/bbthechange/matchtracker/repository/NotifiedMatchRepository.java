package com.bbthechange.matchtracker.repository;

import com.bbthechange.matchtracker.model.NotificationCategory;

import java.util.Set;

/**
 * Durable notified sets, one per notification category.
 * An entry is inserted once and only removed by event-level cleanup.
 */
public interface NotifiedMatchRepository {

    boolean isNotified(String eventId, NotificationCategory category, String matchId);

    /**
     * Insert an entry if absent.
     *
     * @return true if this call inserted it, false if it was already present
     */
    boolean markNotified(String eventId, NotificationCategory category, String matchId);

    /**
     * Remove every entry of an event.
     *
     * @return number of entries removed
     */
    int deleteByEventId(String eventId);

    /**
     * Event ids that currently have at least one entry.
     */
    Set<String> findEventIdsWithEntries();
}
