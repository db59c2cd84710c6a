package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.model.TrackedEvent;
import com.bbthechange.matchtracker.model.WakeupTimer;
import com.bbthechange.matchtracker.testutil.RecordingJobControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WakeupPlannerTest {

    // Day 0, 12:00 in Shanghai
    private static final Instant NOW = Instant.parse("2026-06-10T04:00:00Z");

    private RecordingJobControl jobControl;
    private WakeupPlanner planner;
    private List<String> wokenEvents;

    @BeforeEach
    void setUp() {
        jobControl = new RecordingJobControl();
        planner = new WakeupPlanner(new EventPhaseEvaluator(new TrackerProperties()), jobControl);
        wokenEvents = new ArrayList<>();
    }

    private static TrackedEvent event(String eventId, String start, String end) {
        return new TrackedEvent(eventId, "Event " + eventId, start, end, Set.of("g1"));
    }

    @Nested
    class Scheduling {

        @Test
        void notOngoingEvent_GetsTimerAtStartMinusWindow() {
            // Given: event starts on day 2, now is day 0
            TrackedEvent event = event("100", "06-12", "06-14");

            // When
            List<WakeupTimer> planned = planner.refresh(List.of(event), NOW, wokenEvents::add);

            // Then: one timer at day 1 00:00 local
            assertThat(planned).hasSize(1);
            assertThat(jobControl.scheduledOnceKeys()).containsExactly("wakeup-100");
            assertThat(jobControl.scheduledAt("wakeup-100")).isEqualTo(Instant.parse("2026-06-10T16:00:00Z"));
        }

        @Test
        void firedTimer_InvokesWakeHandlerWithEventId() {
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW, wokenEvents::add);

            jobControl.fire("wakeup-100");

            assertThat(wokenEvents).containsExactly("100");
        }

        @Test
        void activeOrEndedOrUnknownEvents_GetNoTimer() {
            List<TrackedEvent> events = List.of(
                    event("ongoing", "06-09", "06-12"),
                    event("upcoming", "06-11", "06-12"),
                    event("ended", "06-01", "06-05"),
                    event("unknown", "soon", "later"));

            List<WakeupTimer> planned = planner.refresh(events, NOW, wokenEvents::add);

            assertThat(planned).isEmpty();
            assertThat(jobControl.scheduledOnceKeys()).isEmpty();
        }

        @Test
        void refreshTwice_DoesNotRescheduleUnchangedTimer() {
            TrackedEvent event = event("100", "06-12", "06-14");
            planner.refresh(List.of(event), NOW, wokenEvents::add);
            Instant first = jobControl.scheduledAt("wakeup-100");

            planner.refresh(List.of(event), NOW.plusSeconds(60), wokenEvents::add);

            assertThat(jobControl.scheduledOnceKeys()).containsExactly("wakeup-100");
            assertThat(jobControl.scheduledAt("wakeup-100")).isEqualTo(first);
        }

        @Test
        void changedStartDate_ReplacesTimer() {
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW, wokenEvents::add);

            planner.refresh(List.of(event("100", "06-20", "06-22")), NOW, wokenEvents::add);

            assertThat(jobControl.scheduledOnceKeys()).containsExactly("wakeup-100");
            assertThat(jobControl.scheduledAt("wakeup-100")).isEqualTo(Instant.parse("2026-06-18T16:00:00Z"));
        }
    }

    @Nested
    class Cancellation {

        @Test
        void unsubscribedEvent_TimerIsCancelled() {
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW, wokenEvents::add);

            planner.refresh(List.of(), NOW, wokenEvents::add);

            assertThat(jobControl.scheduledOnceKeys()).isEmpty();
        }

        @Test
        void eventEnteringUpcomingWindow_TimerIsCancelled() {
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW, wokenEvents::add);

            // One day later the event is UPCOMING
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW.plusSeconds(86_400), wokenEvents::add);

            assertThat(jobControl.scheduledOnceKeys()).isEmpty();
        }

        @Test
        void nonWakeupJobs_AreLeftAlone() {
            jobControl.scheduleOnce("tracker-bootstrap", NOW.plusSeconds(10), () -> { });

            planner.refresh(List.of(), NOW, wokenEvents::add);

            assertThat(jobControl.scheduledOnceKeys()).containsExactly("tracker-bootstrap");
        }

        @Test
        void cancelForEvent_RemovesPendingTimer() {
            planner.refresh(List.of(event("100", "06-12", "06-14")), NOW, wokenEvents::add);

            planner.cancelForEvent("100");

            assertThat(planner.scheduledEventIds()).isEmpty();
        }
    }
}
