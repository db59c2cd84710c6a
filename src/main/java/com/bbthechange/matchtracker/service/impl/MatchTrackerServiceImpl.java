package com.bbthechange.matchtracker.service.impl;

import com.bbthechange.matchtracker.client.MatchDataSource;
import com.bbthechange.matchtracker.dto.FetchOutcome;
import com.bbthechange.matchtracker.dto.GateOutcome;
import com.bbthechange.matchtracker.dto.TickResult;
import com.bbthechange.matchtracker.dto.TrackerStatus;
import com.bbthechange.matchtracker.dto.UpcomingMatchSummary;
import com.bbthechange.matchtracker.model.EventPhase;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;
import com.bbthechange.matchtracker.model.Subscription;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.repository.NotifiedMatchRepository;
import com.bbthechange.matchtracker.repository.SubscriptionRepository;
import com.bbthechange.matchtracker.service.AdaptiveIntervalController;
import com.bbthechange.matchtracker.service.EventPhaseEvaluator;
import com.bbthechange.matchtracker.service.MatchTrackerService;
import com.bbthechange.matchtracker.service.NotificationGate;
import com.bbthechange.matchtracker.service.RetryableFetcher;
import com.bbthechange.matchtracker.service.WakeupPlanner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Implementation of MatchTrackerService.
 * Holds the single-active-tick guard; all PollState and notified-set writes happen inside a tick
 * or inside subscribe/unsubscribe/initialize.
 */
@Service
public class MatchTrackerServiceImpl implements MatchTrackerService {

    private static final Logger logger = LoggerFactory.getLogger(MatchTrackerServiceImpl.class);

    private final SubscriptionRepository subscriptionRepository;
    private final NotifiedMatchRepository notifiedRepository;
    private final MatchDataSource dataSource;
    private final RetryableFetcher fetcher;
    private final EventPhaseEvaluator phaseEvaluator;
    private final WakeupPlanner wakeupPlanner;
    private final AdaptiveIntervalController intervalController;
    private final NotificationGate notificationGate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicBoolean tickInFlight = new AtomicBoolean(false);
    private final Object wakeupLock = new Object();
    private final AtomicInteger activeEventsGaugeValue = new AtomicInteger(0);

    @Autowired
    public MatchTrackerServiceImpl(SubscriptionRepository subscriptionRepository,
                                   NotifiedMatchRepository notifiedRepository,
                                   MatchDataSource dataSource,
                                   RetryableFetcher fetcher,
                                   EventPhaseEvaluator phaseEvaluator,
                                   WakeupPlanner wakeupPlanner,
                                   AdaptiveIntervalController intervalController,
                                   NotificationGate notificationGate,
                                   MeterRegistry meterRegistry,
                                   Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.notifiedRepository = notifiedRepository;
        this.dataSource = dataSource;
        this.fetcher = fetcher;
        this.phaseEvaluator = phaseEvaluator;
        this.wakeupPlanner = wakeupPlanner;
        this.intervalController = intervalController;
        this.notificationGate = notificationGate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        meterRegistry.gauge("tracker_active_events", activeEventsGaugeValue);
    }

    @Override
    public Subscription subscribe(String groupId, String eventId, String title, String startDate, String endDate) {
        requireId(groupId, "groupId");
        requireId(eventId, "eventId");
        Instant now = clock.instant();

        boolean resubscribe = subscriptionRepository.find(groupId, eventId).isPresent();
        Subscription subscription = subscriptionRepository.save(
                new Subscription(groupId, eventId, title, startDate, endDate));

        if (resubscribe) {
            int removed = notificationGate.forgetEvent(eventId);
            logger.info("Group {} re-subscribed to event {}, reset {} notified entries", groupId, eventId, removed);
        }

        EventPhase phase = phaseEvaluator.evaluate(startDate, endDate, now);
        logger.info("Group {} subscribed to event {} '{}' ({} to {}), phase {}",
                groupId, eventId, title, startDate, endDate, phase);

        if (phase == EventPhase.ONGOING) {
            baselineResults(eventId);
        }

        syncRecurringState(loadTrackedEvents(), now);
        refreshWakeTimers();

        meterRegistry.counter("tracker_subscription_total", "action", resubscribe ? "resubscribe" : "subscribe").increment();
        return subscription;
    }

    @Override
    public boolean unsubscribe(String groupId, String eventId) {
        requireId(groupId, "groupId");
        requireId(eventId, "eventId");
        Instant now = clock.instant();

        boolean existed = subscriptionRepository.delete(groupId, eventId);
        if (!existed) {
            logger.info("Group {} was not subscribed to event {}", groupId, eventId);
            return false;
        }

        if (subscriptionRepository.findByEventId(eventId).isEmpty()) {
            wakeupPlanner.cancelForEvent(eventId);
            notificationGate.forgetEvent(eventId);
            logger.info("Event {} has no subscribers left, stopped tracking", eventId);
        }

        syncRecurringState(loadTrackedEvents(), now);
        refreshWakeTimers();

        meterRegistry.counter("tracker_subscription_total", "action", "unsubscribe").increment();
        logger.info("Group {} unsubscribed from event {}", groupId, eventId);
        return true;
    }

    @Override
    public TickResult tick() {
        if (!tickInFlight.compareAndSet(false, true)) {
            logger.info("Tick already in progress, skipping");
            meterRegistry.counter("tracker_tick_total", "status", TickResult.STATUS_SKIPPED).increment();
            return TickResult.skipped();
        }

        Timer.Sample timer = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            Instant now = clock.instant();

            // 1. Classify subscribed events
            List<TrackedEvent> events = loadTrackedEvents();
            Map<TrackedEvent, EventPhase> activeEvents = new LinkedHashMap<>();
            for (TrackedEvent event : events) {
                EventPhase phase = phaseEvaluator.evaluate(event, now);
                if (phase.isActive()) {
                    activeEvents.put(event, phase);
                }
            }
            activeEventsGaugeValue.set(activeEvents.size());

            // 2. Idle when nothing is active
            if (activeEvents.isEmpty()) {
                intervalController.pause();
                refreshWakeTimers();
                recordTickMetrics(timer, TickResult.STATUS_IDLE);
                return TickResult.idle(System.currentTimeMillis() - startTime);
            }

            intervalController.ensureRunning();
            intervalController.beginTick();

            int starts = 0;
            int results = 0;
            int withheld = 0;
            int pending = 0;
            int fetchErrors = 0;

            for (Map.Entry<TrackedEvent, EventPhase> entry : activeEvents.entrySet()) {
                TrackedEvent event = entry.getKey();
                String eventId = event.getEventId();
                Supplier<Set<String>> recipients = recipientsOf(eventId);

                // 3. Matches: live and next-match signals, then start notifications
                FetchOutcome<Match> matches = fetcher.fetch("fetchMatches[" + eventId + "]",
                        () -> dataSource.fetchMatches(eventId));
                if (matches.isFailed()) {
                    intervalController.recordFetchError();
                    fetchErrors++;
                } else {
                    intervalController.observeMatches(matches.getData(), now);
                    starts += notificationGate.processStarts(event, matches.getData(), now, recipients).notified();
                }

                // 4. Results only while the event is running
                if (entry.getValue() == EventPhase.ONGOING) {
                    FetchOutcome<MatchResult> fetched = fetcher.fetch("fetchResults[" + eventId + "]",
                            () -> dataSource.fetchResults(eventId));
                    if (fetched.isFailed()) {
                        intervalController.recordFetchError();
                        fetchErrors++;
                    } else {
                        GateOutcome outcome = notificationGate.processResults(event, fetched.getData(), recipients);
                        results += outcome.notified();
                        withheld += outcome.withheld();
                        pending += outcome.deliveryPending();
                    }
                }
            }

            // 5. Next interval
            int interval = intervalController.applyTargetInterval(now);

            // 6. Wake timers, against the subscriptions as they are now
            refreshWakeTimers();

            TickResult result = TickResult.success(activeEvents.size(), interval,
                    System.currentTimeMillis() - startTime);
            result.setStartNotifications(starts);
            result.setResultNotifications(results);
            result.setWithheldResults(withheld);
            result.setPendingDeliveries(pending);
            result.setFetchErrors(fetchErrors);

            recordTickMetrics(timer, TickResult.STATUS_SUCCESS);
            logger.info("Tick completed: {}", result);
            return result;

        } catch (Exception e) {
            long durationMs = System.currentTimeMillis() - startTime;
            recordTickMetrics(timer, TickResult.STATUS_ERROR);
            logger.error("Tick failed after {}ms", durationMs, e);
            return TickResult.error(durationMs);
        } finally {
            tickInFlight.set(false);
        }
    }

    @Override
    public TickResult onWakeup(String eventId) {
        logger.info("Wake timer fired for event {}", eventId);
        intervalController.activate();
        return tick();
    }

    @Override
    public List<UpcomingMatchSummary> getUpcomingSummary() {
        Instant now = clock.instant();
        List<UpcomingMatchSummary> upcoming = new ArrayList<>();

        for (TrackedEvent event : loadTrackedEvents()) {
            EventPhase phase = phaseEvaluator.evaluate(event, now);
            if (phase == EventPhase.ENDED || phase == EventPhase.UNKNOWN) {
                continue;
            }

            FetchOutcome<Match> matches = fetcher.fetch("upcomingMatches[" + event.getEventId() + "]",
                    () -> dataSource.fetchMatches(event.getEventId()));
            for (Match match : matches.getData()) {
                if (match.isLive()) {
                    continue;
                }
                if (match.hasScheduledTime() && match.getScheduledTime().isBefore(now)) {
                    continue;
                }
                upcoming.add(UpcomingMatchSummary.builder()
                        .eventId(event.getEventId())
                        .eventTitle(event.getTitle())
                        .matchId(match.getId())
                        .teamA(match.getTeamA())
                        .teamB(match.getTeamB())
                        .mapsFormat(match.getMapsFormat())
                        .scheduledTime(match.getScheduledTime())
                        .minutesUntilStart(match.hasScheduledTime()
                                ? Duration.between(now, match.getScheduledTime()).toMinutes()
                                : null)
                        .build());
            }
        }

        upcoming.sort(Comparator.comparing(UpcomingMatchSummary::getScheduledTime,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return upcoming;
    }

    @Override
    public TrackerStatus getStatus() {
        Instant now = clock.instant();
        Map<String, EventPhase> phases = new TreeMap<>();
        for (TrackedEvent event : loadTrackedEvents()) {
            phases.put(event.getEventId(), phaseEvaluator.evaluate(event, now));
        }
        return new TrackerStatus(intervalController.snapshot(), phases, wakeupPlanner.scheduledEventIds());
    }

    @Override
    public void initialize() {
        Instant now = clock.instant();
        List<TrackedEvent> events = loadTrackedEvents();
        logger.info("Initializing tracker with {} subscribed events", events.size());

        // 1. Existing results of running events are not news
        for (TrackedEvent event : events) {
            if (phaseEvaluator.evaluate(event, now) == EventPhase.ONGOING) {
                baselineResults(event.getEventId());
            }
        }

        // 2. Notified entries of events nobody tracks anymore
        Set<String> subscribed = new TreeSet<>();
        for (TrackedEvent event : events) {
            subscribed.add(event.getEventId());
        }
        for (String eventId : notifiedRepository.findEventIdsWithEntries()) {
            if (!subscribed.contains(eventId)) {
                notificationGate.forgetEvent(eventId);
            }
        }

        // 3. Recurring trigger and wake timers
        syncRecurringState(events, now);
        refreshWakeTimers();
        logger.info("Tracker initialized");
    }

    private void baselineResults(String eventId) {
        FetchOutcome<MatchResult> results = fetcher.fetch("baselineResults[" + eventId + "]",
                () -> dataSource.fetchResults(eventId));
        if (results.isFailed()) {
            logger.warn("Could not fetch existing results for event {}, skipping baseline", eventId);
            return;
        }
        notificationGate.baselineResults(eventId, results.getData());
    }

    private void syncRecurringState(List<TrackedEvent> events, Instant now) {
        boolean anyActive = events.stream()
                .anyMatch(event -> phaseEvaluator.evaluate(event, now).isActive());
        if (anyActive) {
            intervalController.activate();
        } else {
            intervalController.pause();
        }
    }

    /**
     * Reconcile wake timers with a fresh read of the subscriptions. The read happens inside the
     * lock, so the last refresh to run always sees the latest subscription change.
     */
    private void refreshWakeTimers() {
        synchronized (wakeupLock) {
            wakeupPlanner.refresh(loadTrackedEvents(), clock.instant(), this::handleWakeup);
        }
    }

    private void handleWakeup(String eventId) {
        onWakeup(eventId);
    }

    /**
     * Groups subscribed to the event, read on first use and reused for the rest of the pass.
     */
    private Supplier<Set<String>> recipientsOf(String eventId) {
        return new Supplier<>() {
            private Set<String> groups;

            @Override
            public Set<String> get() {
                if (groups == null) {
                    groups = new TreeSet<>();
                    for (Subscription subscription : subscriptionRepository.findByEventId(eventId)) {
                        groups.add(subscription.getGroupId());
                    }
                }
                return groups;
            }
        };
    }

    private List<TrackedEvent> loadTrackedEvents() {
        Map<String, List<Subscription>> byEvent = new TreeMap<>();
        for (Subscription subscription : subscriptionRepository.findAll()) {
            byEvent.computeIfAbsent(subscription.getEventId(), id -> new ArrayList<>()).add(subscription);
        }

        List<TrackedEvent> events = new ArrayList<>();
        for (List<Subscription> subscriptions : byEvent.values()) {
            events.add(TrackedEvent.fromSubscriptions(subscriptions));
        }
        return events;
    }

    private void recordTickMetrics(Timer.Sample timer, String status) {
        timer.stop(Timer.builder("tracker_tick_duration")
                .tag("status", status)
                .register(meterRegistry));
        meterRegistry.counter("tracker_tick_total", "status", status).increment();
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
