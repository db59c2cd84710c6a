package com.bbthechange.matchtracker.config;

import com.bbthechange.matchtracker.service.AdaptiveIntervalController;
import com.bbthechange.matchtracker.service.MatchTrackerService;
import com.bbthechange.matchtracker.testutil.RecordingJobControl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TrackerBootstrapTest {

    private static final Instant NOW = Instant.parse("2026-06-10T04:00:00Z");

    @Mock
    private MatchTrackerService trackerService;

    private RecordingJobControl jobControl;
    private SimpleMeterRegistry meterRegistry;
    private TrackerBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        jobControl = new RecordingJobControl();
        meterRegistry = new SimpleMeterRegistry();
        TrackerProperties properties = new TrackerProperties();
        AdaptiveIntervalController intervalController =
                new AdaptiveIntervalController(jobControl, properties, meterRegistry);
        bootstrap = new TrackerBootstrap(trackerService, intervalController, jobControl, properties,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void run_RegistersTickAndDelaysInitialization() {
        // When
        bootstrap.run(null);

        // Then
        assertThat(jobControl.getRecurringInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(jobControl.scheduledAt(TrackerBootstrap.BOOTSTRAP_JOB_KEY)).isEqualTo(NOW.plusSeconds(10));
        verify(trackerService, never()).initialize();

        jobControl.getRecurringTask().run();
        verify(trackerService).tick();
    }

    @Test
    void bootstrapJob_RunsInitialization() {
        bootstrap.run(null);

        jobControl.fire(TrackerBootstrap.BOOTSTRAP_JOB_KEY);

        verify(trackerService).initialize();
        assertThat(meterRegistry.counter("tracker_bootstrap_total", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void initialize_Failure_IsLoggedAndCounted() {
        doThrow(new IllegalStateException("table missing")).when(trackerService).initialize();

        bootstrap.initialize();

        assertThat(meterRegistry.counter("tracker_bootstrap_total", "status", "error").count()).isEqualTo(1.0);
    }
}
