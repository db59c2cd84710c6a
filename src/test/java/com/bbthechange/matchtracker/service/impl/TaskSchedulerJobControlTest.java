package com.bbthechange.matchtracker.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaskSchedulerJobControlTest {

    private static final Instant NOW = Instant.parse("2026-06-10T04:00:00Z");

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> recurringFuture;

    @Mock
    private ScheduledFuture<Object> onceFuture;

    private TaskSchedulerJobControl jobControl;

    @BeforeEach
    void setUp() {
        jobControl = new TaskSchedulerJobControl(taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    class Recurring {

        private final Runnable tick = () -> { };

        @Test
        void registerRecurring_SchedulesWithFixedDelayFromNow() {
            // Given
            doReturn(recurringFuture).when(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

            // When
            jobControl.registerRecurring(tick, Duration.ofMinutes(5));

            // Then
            verify(taskScheduler).scheduleWithFixedDelay(tick, NOW.plus(Duration.ofMinutes(5)), Duration.ofMinutes(5));
            assertThat(jobControl.isRecurringPaused()).isFalse();
        }

        @Test
        void pauseRecurring_CancelsFutureOnce() {
            doReturn(recurringFuture).when(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
            jobControl.registerRecurring(tick, Duration.ofMinutes(5));

            jobControl.pauseRecurring();
            jobControl.pauseRecurring();

            verify(recurringFuture, times(1)).cancel(false);
            assertThat(jobControl.isRecurringPaused()).isTrue();
        }

        @Test
        void rescheduleWhilePaused_AppliesIntervalOnResume() {
            // Given
            doReturn(recurringFuture).when(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
            jobControl.registerRecurring(tick, Duration.ofMinutes(5));
            jobControl.pauseRecurring();

            // When
            jobControl.rescheduleRecurring(Duration.ofMinutes(60));

            // Then nothing is scheduled until resumed
            verify(taskScheduler, times(1))
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

            jobControl.resumeRecurring();
            verify(taskScheduler).scheduleWithFixedDelay(tick, NOW.plus(Duration.ofMinutes(60)), Duration.ofMinutes(60));
        }

        @Test
        void rescheduleRecurring_ReplacesRunningFuture() {
            doReturn(recurringFuture).when(taskScheduler)
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
            jobControl.registerRecurring(tick, Duration.ofMinutes(5));

            jobControl.rescheduleRecurring(Duration.ofMinutes(15));

            verify(recurringFuture).cancel(false);
            verify(taskScheduler).scheduleWithFixedDelay(tick, NOW.plus(Duration.ofMinutes(15)), Duration.ofMinutes(15));
        }

        @Test
        void resumeRecurring_NotPaused_DoesNothing() {
            jobControl.resumeRecurring();

            verify(taskScheduler, never())
                    .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        }
    }

    @Nested
    class OneShot {

        @Test
        void scheduleOnce_RunsCallbackAndForgetsKey() {
            // Given
            AtomicInteger runs = new AtomicInteger();
            doReturn(onceFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
            Instant fireAt = NOW.plus(Duration.ofHours(3));

            // When
            jobControl.scheduleOnce("wakeup-7148", fireAt, runs::incrementAndGet);

            // Then
            assertThat(jobControl.scheduledOnceKeys()).containsExactly("wakeup-7148");
            ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(captor.capture(), eq(fireAt));

            captor.getValue().run();
            assertThat(runs.get()).isEqualTo(1);
            assertThat(jobControl.scheduledOnceKeys()).isEmpty();
        }

        @Test
        void cancelOnce_CancelsFutureAndSkipsCallback() {
            // Given
            AtomicInteger runs = new AtomicInteger();
            doReturn(onceFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
            jobControl.scheduleOnce("wakeup-7148", NOW.plus(Duration.ofHours(3)), runs::incrementAndGet);
            ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(captor.capture(), any(Instant.class));

            // When
            jobControl.cancelOnce("wakeup-7148");
            captor.getValue().run();

            // Then
            verify(onceFuture).cancel(false);
            assertThat(runs.get()).isZero();
            assertThat(jobControl.scheduledOnceKeys()).isEmpty();
        }

        @Test
        void scheduleOnce_SameKey_ReplacesPreviousJob() {
            doReturn(onceFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

            jobControl.scheduleOnce("wakeup-7148", NOW.plus(Duration.ofHours(3)), () -> { });
            jobControl.scheduleOnce("wakeup-7148", NOW.plus(Duration.ofHours(4)), () -> { });

            verify(onceFuture, times(1)).cancel(false);
            assertThat(jobControl.scheduledOnceKeys()).containsExactly("wakeup-7148");
        }
    }
}
