package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.model.EventPhase;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.model.WakeupTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Keeps exactly one wake timer per NOT_ONGOING event, firing when the event enters its
 * upcoming window, and none for events in any other phase.
 *
 * Timers live only in memory; refresh is re-run at startup to rebuild them from subscriptions.
 */
@Component
public class WakeupPlanner {

    private static final Logger logger = LoggerFactory.getLogger(WakeupPlanner.class);

    private final EventPhaseEvaluator phaseEvaluator;
    private final JobControl jobControl;

    // Last fire time handed to JobControl per key, to skip identical re-schedules
    private final Map<String, Instant> plannedFireTimes = new ConcurrentHashMap<>();

    @Autowired
    public WakeupPlanner(EventPhaseEvaluator phaseEvaluator, JobControl jobControl) {
        this.phaseEvaluator = phaseEvaluator;
        this.jobControl = jobControl;
    }

    /**
     * Reconcile scheduled wake timers with the current subscriptions.
     *
     * @param events       every currently subscribed event
     * @param now          evaluation instant
     * @param wakeHandler  invoked with the event id when a timer fires
     * @return the timers that are scheduled after reconciliation
     */
    public List<WakeupTimer> refresh(List<TrackedEvent> events, Instant now, Consumer<String> wakeHandler) {
        Set<String> scheduledKeys = new HashSet<>();
        for (String key : jobControl.scheduledOnceKeys()) {
            if (WakeupTimer.isWakeupKey(key)) {
                scheduledKeys.add(key);
            }
        }
        plannedFireTimes.keySet().retainAll(scheduledKeys);

        // 1. Cancel timers of events nobody subscribes to anymore
        Set<String> subscribedKeys = new HashSet<>();
        for (TrackedEvent event : events) {
            subscribedKeys.add(WakeupTimer.keyFor(event.getEventId()));
        }
        for (String key : scheduledKeys) {
            if (!subscribedKeys.contains(key)) {
                logger.info("Cancelling wake timer for unsubscribed event {}", WakeupTimer.eventIdFromKey(key));
                cancel(key);
            }
        }

        // 2. Plan each subscribed event
        List<WakeupTimer> planned = new ArrayList<>();
        for (TrackedEvent event : events) {
            String key = WakeupTimer.keyFor(event.getEventId());
            EventPhase phase = phaseEvaluator.evaluate(event, now);

            if (phase != EventPhase.NOT_ONGOING) {
                if (scheduledKeys.contains(key)) {
                    logger.info("Event {} is {}, cancelling its wake timer", event.getEventId(), phase);
                    cancel(key);
                }
                continue;
            }

            Optional<Instant> fireAt = phaseEvaluator.upcomingAt(event, now);
            if (fireAt.isEmpty() || !fireAt.get().isAfter(now)) {
                // Already inside the window; the periodic tick picks it up
                if (scheduledKeys.contains(key)) {
                    cancel(key);
                }
                continue;
            }

            WakeupTimer timer = new WakeupTimer(event.getEventId(), fireAt.get());
            if (!scheduledKeys.contains(key) || !fireAt.get().equals(plannedFireTimes.get(key))) {
                String eventId = event.getEventId();
                jobControl.scheduleOnce(key, timer.getFireAt(), () -> wakeHandler.accept(eventId));
                plannedFireTimes.put(key, timer.getFireAt());
                logger.info("Wake timer for event {} set to {}", eventId, timer.getFireAt());
            }
            planned.add(timer);
        }
        return planned;
    }

    /**
     * Events that currently have a pending wake timer.
     */
    public Set<String> scheduledEventIds() {
        Set<String> eventIds = new TreeSet<>();
        for (String key : jobControl.scheduledOnceKeys()) {
            if (WakeupTimer.isWakeupKey(key)) {
                eventIds.add(WakeupTimer.eventIdFromKey(key));
            }
        }
        return eventIds;
    }

    /**
     * Cancel the wake timer for a single event, if one is pending.
     */
    public void cancelForEvent(String eventId) {
        cancel(WakeupTimer.keyFor(eventId));
    }

    private void cancel(String key) {
        jobControl.cancelOnce(key);
        plannedFireTimes.remove(key);
    }
}
