package com.bbthechange.matchtracker.service.impl;

import com.bbthechange.matchtracker.dto.NotificationPayload;
import com.bbthechange.matchtracker.service.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Sink used when SNS is not configured: writes the notification to the log and acknowledges it.
 */
@Service
@ConditionalOnProperty(name = "tracker.notifications.sns.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public boolean deliver(String groupId, NotificationPayload payload) {
        logger.info("[Notification Bypass] group={} category={} match={} title='{}' body='{}'",
                groupId, payload.getCategory(), payload.getMatchId(), payload.getTitle(), payload.getBody());
        return true;
    }
}
