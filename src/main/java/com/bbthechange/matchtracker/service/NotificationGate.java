package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.dto.GateOutcome;
import com.bbthechange.matchtracker.dto.NotificationPayload;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;
import com.bbthechange.matchtracker.model.NotificationCategory;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.repository.NotifiedMatchRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * At-most-once start and result notifications.
 *
 * Starts are claimed in the notified set before delivery and never retried.
 * Results are only sent once complete, and only marked once every group acknowledged;
 * unacknowledged groups are retried on later ticks. A result no group has accepted yet
 * stays unmarked until one does.
 */
@Component
public class NotificationGate {

    private static final Logger logger = LoggerFactory.getLogger(NotificationGate.class);

    /**
     * Signal that made a match eligible for its start notification.
     */
    public enum StartStage {
        LIVE,
        TIME_HIDDEN,
        OVERDUE
    }

    private final NotifiedMatchRepository notifiedRepository;
    private final NotificationSink notificationSink;
    private final NotificationTextGenerator textGenerator;
    private final MeterRegistry meterRegistry;
    private final Duration overdueThreshold;
    private final int maxResultAttempts;

    // eventId|matchId -> groups that acknowledged so far
    private final Map<String, PendingResult> pendingResults = new ConcurrentHashMap<>();

    @Autowired
    public NotificationGate(NotifiedMatchRepository notifiedRepository,
                            NotificationSink notificationSink,
                            NotificationTextGenerator textGenerator,
                            MeterRegistry meterRegistry,
                            TrackerProperties properties) {
        this.notifiedRepository = notifiedRepository;
        this.notificationSink = notificationSink;
        this.textGenerator = textGenerator;
        this.meterRegistry = meterRegistry;
        this.overdueThreshold = Duration.ofMinutes(properties.getOverdueThresholdMinutes());
        this.maxResultAttempts = Math.max(1, properties.getNotifications().getMaxResultAttempts());
    }

    /**
     * Which signal, if any, makes the match eligible for a start notification right now.
     */
    public Optional<StartStage> startStage(Match match, Instant now) {
        if (match.isLive()) {
            return Optional.of(StartStage.LIVE);
        }
        if (match.isTbd()) {
            return Optional.empty();
        }
        if (!match.hasScheduledTime()) {
            return Optional.of(StartStage.TIME_HIDDEN);
        }
        Instant scheduled = match.getScheduledTime();
        if (!now.isBefore(scheduled) && !now.isAfter(scheduled.plus(overdueThreshold))) {
            return Optional.of(StartStage.OVERDUE);
        }
        return Optional.empty();
    }

    public GateOutcome processStarts(TrackedEvent event, List<Match> matches, Instant now,
                                     Supplier<Set<String>> recipients) {
        int notified = 0;

        for (Match match : matches) {
            Optional<StartStage> stage = startStage(match, now);
            if (stage.isEmpty()) {
                continue;
            }
            if (notifiedRepository.isNotified(event.getEventId(), NotificationCategory.START, match.getId())) {
                continue;
            }

            Set<String> groups = recipients.get();
            if (groups.isEmpty()) {
                logger.info("No groups subscribed to event {} anymore, skipping start of match {}",
                        event.getEventId(), match.getId());
                continue;
            }

            // Claim before delivery; start notices are never retried
            if (!notifiedRepository.markNotified(event.getEventId(), NotificationCategory.START, match.getId())) {
                continue;
            }

            NotificationPayload payload = NotificationPayload.builder()
                    .category(NotificationCategory.START)
                    .eventId(event.getEventId())
                    .eventTitle(event.getTitle())
                    .matchId(match.getId())
                    .title(NotificationTextGenerator.MATCH_STARTING_TITLE)
                    .body(textGenerator.getMatchStartingBody(match, event.getTitle()))
                    .build();

            int delivered = 0;
            for (String groupId : groups) {
                if (deliver(groupId, payload)) {
                    delivered++;
                }
            }

            logger.info("Start notification for match {} ({}) of event {} delivered to {}/{} groups",
                    match.getId(), stage.get(), event.getEventId(), delivered, groups.size());
            meterRegistry.counter("tracker_notification_total",
                    "category", "start", "stage", stage.get().name().toLowerCase()).increment();
            notified++;
        }

        return new GateOutcome(notified, 0, 0);
    }

    public GateOutcome processResults(TrackedEvent event, List<MatchResult> results,
                                      Supplier<Set<String>> recipients) {
        int notified = 0;
        int withheld = 0;
        int deliveryPending = 0;
        Set<String> seenKeys = new HashSet<>();

        for (MatchResult result : results) {
            String pendingKey = pendingKey(event.getEventId(), result.getId());
            seenKeys.add(pendingKey);

            if (notifiedRepository.isNotified(event.getEventId(), NotificationCategory.RESULT, result.getId())) {
                pendingResults.remove(pendingKey);
                continue;
            }

            if (!result.isComplete()) {
                logger.debug("Result {} of event {} incomplete ({} maps expected), withholding",
                        result.getId(), event.getEventId(), result.expectedMapCount());
                meterRegistry.counter("tracker_notification_total",
                        "category", "result", "stage", "withheld").increment();
                withheld++;
                continue;
            }

            Set<String> groups = recipients.get();
            if (groups.isEmpty()) {
                continue;
            }

            NotificationPayload payload = NotificationPayload.builder()
                    .category(NotificationCategory.RESULT)
                    .eventId(event.getEventId())
                    .eventTitle(event.getTitle())
                    .matchId(result.getId())
                    .title(NotificationTextGenerator.MATCH_RESULT_TITLE)
                    .body(textGenerator.getMatchResultBody(result, event.getTitle()))
                    .build();

            PendingResult pending = pendingResults.computeIfAbsent(pendingKey, key -> new PendingResult());
            for (String groupId : groups) {
                if (!pending.acknowledged.contains(groupId) && deliver(groupId, payload)) {
                    pending.acknowledged.add(groupId);
                }
            }
            pending.attempts++;

            if (pending.acknowledged.containsAll(groups)) {
                markResult(event.getEventId(), result.getId());
                pendingResults.remove(pendingKey);
                logger.info("Result notification for match {} of event {} delivered to {} groups",
                        result.getId(), event.getEventId(), groups.size());
                meterRegistry.counter("tracker_notification_total",
                        "category", "result", "stage", "delivered").increment();
                notified++;
            } else if (pending.attempts >= maxResultAttempts && !pending.acknowledged.isEmpty()) {
                markResult(event.getEventId(), result.getId());
                pendingResults.remove(pendingKey);
                logger.warn("Result for match {} of event {} not acknowledged by all groups after {} attempts, giving up",
                        result.getId(), event.getEventId(), pending.attempts);
                meterRegistry.counter("tracker_notification_total",
                        "category", "result", "stage", "abandoned").increment();
                notified++;
            } else {
                logger.warn("Result for match {} of event {} acknowledged by {}/{} groups, retrying next tick",
                        result.getId(), event.getEventId(), pending.acknowledged.size(), groups.size());
                meterRegistry.counter("tracker_notification_total",
                        "category", "result", "stage", "retry").increment();
                deliveryPending++;
            }
        }

        // Results that left the feed window are not retried
        String prefix = event.getEventId() + "|";
        pendingResults.keySet().removeIf(key -> key.startsWith(prefix) && !seenKeys.contains(key));

        return new GateOutcome(notified, withheld, deliveryPending);
    }

    /**
     * Mark every given result as already notified without delivering anything.
     * Used so a new subscriber is not sent results that predate the subscription.
     */
    public int baselineResults(String eventId, List<MatchResult> results) {
        int marked = 0;
        for (MatchResult result : results) {
            if (notifiedRepository.markNotified(eventId, NotificationCategory.RESULT, result.getId())) {
                marked++;
            }
        }
        if (marked > 0) {
            logger.info("Baseline-marked {} existing results for event {}", marked, eventId);
        }
        return marked;
    }

    /**
     * Drop all notified state of an event, durable and in-memory.
     */
    public int forgetEvent(String eventId) {
        String prefix = eventId + "|";
        pendingResults.keySet().removeIf(key -> key.startsWith(prefix));
        return notifiedRepository.deleteByEventId(eventId);
    }

    int pendingResultCount() {
        return pendingResults.size();
    }

    private void markResult(String eventId, String matchId) {
        notifiedRepository.markNotified(eventId, NotificationCategory.RESULT, matchId);
    }

    private boolean deliver(String groupId, NotificationPayload payload) {
        try {
            boolean ok = notificationSink.deliver(groupId, payload);
            if (!ok) {
                logger.warn("Sink rejected {} notification for match {} to group {}",
                        payload.getCategory(), payload.getMatchId(), groupId);
            }
            return ok;
        } catch (RuntimeException e) {
            logger.error("Sink failed delivering {} notification for match {} to group {}",
                    payload.getCategory(), payload.getMatchId(), groupId, e);
            return false;
        }
    }

    private static String pendingKey(String eventId, String matchId) {
        return eventId + "|" + matchId;
    }

    private static final class PendingResult {
        private final Set<String> acknowledged = new HashSet<>();
        private int attempts;
    }
}
