package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.model.EventPhase;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.util.TrackerDateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Classifies a tracked event into its lifecycle phase.
 *
 * Phases are checked in this order:
 * 1. ENDED        now is after end + grace
 * 2. ONGOING      start <= now <= end + grace
 * 3. UPCOMING     start - window <= now < start
 * 4. NOT_ONGOING  now < start - window
 * Unparsable dates give UNKNOWN.
 */
@Component
public class EventPhaseEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(EventPhaseEvaluator.class);

    private final ZoneId zone;
    private final Duration upcomingWindow;
    private final Duration endGrace;

    @Autowired
    public EventPhaseEvaluator(TrackerProperties properties) {
        this.zone = ZoneId.of(properties.getTimezone());
        this.upcomingWindow = Duration.ofHours(properties.getUpcomingWindowHours());
        this.endGrace = Duration.ofDays(properties.getEndGraceDays());
    }

    public EventPhase evaluate(TrackedEvent event, Instant now) {
        return evaluate(event.getStartDate(), event.getEndDate(), now);
    }

    public EventPhase evaluate(String startDate, String endDate, Instant now) {
        Optional<EventWindow> window = resolveWindow(startDate, endDate, now);
        if (window.isEmpty()) {
            logger.warn("Cannot resolve event dates start={} end={}, treating as UNKNOWN", startDate, endDate);
            return EventPhase.UNKNOWN;
        }

        Instant start = window.get().start();
        Instant endWithGrace = window.get().end().plus(endGrace);

        if (now.isAfter(endWithGrace)) {
            return EventPhase.ENDED;
        }
        if (!now.isBefore(start)) {
            return EventPhase.ONGOING;
        }
        if (!now.isBefore(start.minus(upcomingWindow))) {
            return EventPhase.UPCOMING;
        }
        return EventPhase.NOT_ONGOING;
    }

    /**
     * Instant at which a dormant event enters its upcoming window, if its start date resolves.
     */
    public Optional<Instant> upcomingAt(TrackedEvent event, Instant now) {
        return resolveWindow(event.getStartDate(), event.getEndDate(), now)
                .map(window -> window.start().minus(upcomingWindow));
    }

    Optional<EventWindow> resolveWindow(String startDate, String endDate, Instant now) {
        Instant start = TrackerDateParser.parseStartOfDay(startDate, zone, now);
        Instant end = TrackerDateParser.parseEndOfDay(endDate, zone, now);
        if (start == null || end == null) {
            return Optional.empty();
        }
        // A window spanning new year: end rolled over, start did not.
        if (end.isBefore(start)) {
            ZonedDateTime earlier = start.atZone(zone).minusYears(1);
            start = earlier.toInstant();
            if (end.isBefore(start)) {
                return Optional.empty();
            }
        }
        return Optional.of(new EventWindow(start, end));
    }

    record EventWindow(Instant start, Instant end) {
    }
}
