package com.bbthechange.matchtracker.util;

import com.bbthechange.matchtracker.exception.InvalidKeyException;
import com.bbthechange.matchtracker.model.NotificationCategory;

/**
 * Key factory for the MatchTrackerTable single-table layout.
 */
public final class TrackerKeyFactory {
    private static final String DELIMITER = "#";

    public static final String EVENT_PREFIX = "EVENT";
    public static final String GROUP_PREFIX = "GROUP";
    public static final String NOTIFIED_PREFIX = "NOTIFIED";

    private TrackerKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (id.contains(DELIMITER)) {
            throw new InvalidKeyException("Invalid " + type + " ID, must not contain '" + DELIMITER + "': " + id);
        }
    }

    public static String getEventPk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }

    public static String getSubscriptionSk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getNotifiedSk(NotificationCategory category, String matchId) {
        validateId(matchId, "Match");
        return getNotifiedPrefix() + category.name() + DELIMITER + matchId;
    }

    /**
     * Sort key prefix shared by every notified entry of an event.
     */
    public static String getNotifiedPrefix() {
        return NOTIFIED_PREFIX + DELIMITER;
    }

    public static String getSubscriptionPrefix() {
        return GROUP_PREFIX + DELIMITER;
    }
}
