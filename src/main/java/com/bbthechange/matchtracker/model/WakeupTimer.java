package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * One-shot timer that reactivates polling for a dormant event.
 */
@Data
@AllArgsConstructor
public class WakeupTimer {

    public static final String KEY_PREFIX = "wakeup-";

    private String eventId;
    private Instant fireAt;

    public String getKey() {
        return keyFor(eventId);
    }

    public static String keyFor(String eventId) {
        return KEY_PREFIX + eventId;
    }

    public static boolean isWakeupKey(String key) {
        return key != null && key.startsWith(KEY_PREFIX);
    }

    public static String eventIdFromKey(String key) {
        return key.substring(KEY_PREFIX.length());
    }
}
