package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.dto.NotificationPayload;

/**
 * Delivers a notification to one destination group.
 */
public interface NotificationSink {

    /**
     * @return true when the destination acknowledged the notification
     */
    boolean deliver(String groupId, NotificationPayload payload);
}
