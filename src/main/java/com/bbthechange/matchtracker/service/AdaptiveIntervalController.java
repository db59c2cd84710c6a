package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.PollState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns PollState and turns the signals gathered during a tick into the next polling interval.
 *
 * Target interval, first rule that applies:
 * 1. a fetch failed this tick              -> minimum
 * 2. a match is live                       -> minimum
 * 3. a match was live within the grace     -> minimum
 * 4. otherwise the next-match hint mapped through the step table
 */
@Component
public class AdaptiveIntervalController {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveIntervalController.class);

    private final JobControl jobControl;
    private final MeterRegistry meterRegistry;
    private final int minIntervalMinutes;
    private final int longestIntervalMinutes;
    private final List<TrackerProperties.IntervalStep> steps;
    private final Duration overdueThreshold;
    private final Duration postLiveGrace;

    private final PollState state;
    private final AtomicInteger intervalGaugeValue;

    @Autowired
    public AdaptiveIntervalController(JobControl jobControl, TrackerProperties properties, MeterRegistry meterRegistry) {
        this.jobControl = jobControl;
        this.meterRegistry = meterRegistry;
        this.minIntervalMinutes = Math.max(1, properties.getMinIntervalMinutes());
        this.longestIntervalMinutes = Math.max(minIntervalMinutes, properties.getLongestIntervalMinutes());
        this.overdueThreshold = Duration.ofMinutes(properties.getOverdueThresholdMinutes());
        this.postLiveGrace = Duration.ofMinutes(properties.getPostLiveGraceMinutes());

        List<TrackerProperties.IntervalStep> sorted = new ArrayList<>(properties.getIntervalSteps());
        sorted.sort(Comparator.comparingInt(TrackerProperties.IntervalStep::getMaxMinutesUntil));
        this.steps = List.copyOf(sorted);

        int initial = Math.max(minIntervalMinutes, properties.getDefaultIntervalMinutes());
        this.state = new PollState(initial);
        this.intervalGaugeValue = new AtomicInteger(initial);
        meterRegistry.gauge("tracker_poll_interval_minutes", intervalGaugeValue);
    }

    /**
     * Clear the per-tick signals. The current interval and last live sighting carry over.
     */
    public synchronized void beginTick() {
        state.setNextMinutesHint(null);
        state.setLiveMatch(false);
        state.setFetchError(false);
    }

    public synchronized void recordFetchError() {
        state.setFetchError(true);
    }

    /**
     * Fold one event's matches into the live flag and the next-match hint.
     */
    public synchronized void observeMatches(List<Match> matches, Instant now) {
        for (Match match : matches) {
            if (match.isLive()) {
                state.setLiveMatch(true);
                state.setLastLiveSeenAt(now);
                continue;
            }
            if (match.isTbd()) {
                continue;
            }
            if (!match.hasScheduledTime()) {
                // Time hidden upstream usually means it is about to start
                offerHint(0);
                continue;
            }

            Duration until = Duration.between(now, match.getScheduledTime());
            if (until.toMinutes() > 0) {
                offerHint(until.toMinutes());
            } else if (until.negated().compareTo(overdueThreshold) <= 0) {
                offerHint(0);
            }
        }
    }

    private void offerHint(long minutes) {
        int value = (int) Math.min(Integer.MAX_VALUE, minutes);
        Integer current = state.getNextMinutesHint();
        if (current == null || value < current) {
            state.setNextMinutesHint(value);
        }
    }

    public synchronized int computeTargetInterval(Instant now) {
        if (state.isFetchError()) {
            return minIntervalMinutes;
        }
        if (state.isLiveMatch()) {
            return minIntervalMinutes;
        }
        Instant lastLive = state.getLastLiveSeenAt();
        if (lastLive != null && !now.isAfter(lastLive.plus(postLiveGrace))) {
            return minIntervalMinutes;
        }
        return intervalForHint(state.getNextMinutesHint());
    }

    /**
     * Step-table lookup. A missing hint maps to the longest interval.
     */
    public int intervalForHint(Integer minutesUntilNext) {
        if (minutesUntilNext == null) {
            return longestIntervalMinutes;
        }
        for (TrackerProperties.IntervalStep step : steps) {
            if (minutesUntilNext <= step.getMaxMinutesUntil()) {
                return Math.max(minIntervalMinutes, step.getIntervalMinutes());
            }
        }
        return longestIntervalMinutes;
    }

    /**
     * Reschedule the recurring tick when the target interval differs from the current one.
     *
     * @return the interval in effect after the call
     */
    public synchronized int applyTargetInterval(Instant now) {
        int target = computeTargetInterval(now);
        if (target != state.getCurrentIntervalMinutes()) {
            logger.info("Polling interval {} -> {} minutes (live={}, fetchError={}, nextMinutes={})",
                    state.getCurrentIntervalMinutes(), target, state.isLiveMatch(),
                    state.isFetchError(), state.getNextMinutesHint());
            setInterval(target);
        }
        return state.getCurrentIntervalMinutes();
    }

    /**
     * Stop the recurring tick while nothing is active.
     */
    public synchronized void pause() {
        if (!state.isPaused()) {
            jobControl.pauseRecurring();
            state.setPaused(true);
            logger.info("No active events, polling paused");
        }
    }

    /**
     * Make sure the recurring tick is running, without touching its interval.
     */
    public synchronized void ensureRunning() {
        if (state.isPaused() || jobControl.isRecurringPaused()) {
            jobControl.resumeRecurring();
            state.setPaused(false);
            logger.info("Polling resumed at {} minutes", state.getCurrentIntervalMinutes());
        }
    }

    /**
     * Resume polling at the minimum interval. Used when an event wakes up or is subscribed.
     */
    public synchronized void activate() {
        ensureRunning();
        if (state.getCurrentIntervalMinutes() != minIntervalMinutes) {
            setInterval(minIntervalMinutes);
        }
    }

    private void setInterval(int minutes) {
        int clamped = Math.max(minIntervalMinutes, minutes);
        jobControl.rescheduleRecurring(Duration.ofMinutes(clamped));
        state.setCurrentIntervalMinutes(clamped);
        intervalGaugeValue.set(clamped);
        meterRegistry.counter("tracker_interval_change_total").increment();
    }

    public synchronized int getCurrentIntervalMinutes() {
        return state.getCurrentIntervalMinutes();
    }

    public int getMinIntervalMinutes() {
        return minIntervalMinutes;
    }

    public synchronized PollState snapshot() {
        return state.copy();
    }
}
