package com.bbthechange.matchtracker.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Timer facility driving the tracker: one recurring tick plus keyed one-shot timers.
 */
public interface JobControl {

    /**
     * Register the recurring task. Replaces any previously registered task.
     */
    void registerRecurring(Runnable task, Duration interval);

    void pauseRecurring();

    void resumeRecurring();

    /**
     * Change the recurring interval. The next run happens one interval from now.
     */
    void rescheduleRecurring(Duration interval);

    boolean isRecurringPaused();

    /**
     * Schedule a one-shot callback, replacing any pending one with the same key.
     */
    void scheduleOnce(String key, Instant at, Runnable callback);

    /**
     * Cancel a pending one-shot callback. Unknown keys are ignored.
     */
    void cancelOnce(String key);

    /**
     * Keys of the one-shot callbacks that have not fired yet.
     */
    Set<String> scheduledOnceKeys();
}
