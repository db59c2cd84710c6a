package com.bbthechange.matchtracker.config;

import com.bbthechange.matchtracker.service.AdaptiveIntervalController;
import com.bbthechange.matchtracker.service.JobControl;
import com.bbthechange.matchtracker.service.MatchTrackerService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Registers the recurring tick on startup and runs the tracker's initialization after a short delay,
 * once the store and upstream are reachable.
 */
@Component
@ConditionalOnProperty(name = "tracker.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
public class TrackerBootstrap implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(TrackerBootstrap.class);

    static final String BOOTSTRAP_JOB_KEY = "tracker-bootstrap";

    private final MatchTrackerService trackerService;
    private final AdaptiveIntervalController intervalController;
    private final JobControl jobControl;
    private final TrackerProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public TrackerBootstrap(MatchTrackerService trackerService,
                            AdaptiveIntervalController intervalController,
                            JobControl jobControl,
                            TrackerProperties properties,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.trackerService = trackerService;
        this.intervalController = intervalController;
        this.jobControl = jobControl;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        jobControl.registerRecurring(trackerService::tick,
                Duration.ofMinutes(intervalController.getCurrentIntervalMinutes()));

        Duration delay = properties.getStartupDelay();
        jobControl.scheduleOnce(BOOTSTRAP_JOB_KEY, clock.instant().plus(delay), this::initialize);
        logger.info("Tracker initialization scheduled in {}s", delay.toSeconds());
    }

    void initialize() {
        try {
            trackerService.initialize();
            meterRegistry.counter("tracker_bootstrap_total", "status", "success").increment();
        } catch (Exception e) {
            // Polling still runs; the next tick rebuilds wake timers
            logger.error("Tracker initialization failed", e);
            meterRegistry.counter("tracker_bootstrap_total", "status", "error").increment();
        }
    }
}
