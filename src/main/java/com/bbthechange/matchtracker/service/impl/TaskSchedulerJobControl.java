package com.bbthechange.matchtracker.service.impl;

import com.bbthechange.matchtracker.service.JobControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * JobControl on top of Spring's TaskScheduler.
 * Pausing cancels the recurring future; resuming re-schedules it with the last interval.
 */
@Component
public class TaskSchedulerJobControl implements JobControl {

    private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerJobControl.class);

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Object recurringLock = new Object();
    private Runnable recurringTask;
    private Duration recurringInterval;
    private ScheduledFuture<?> recurringFuture;
    private boolean paused;

    private final Map<String, OnceJob> onceJobs = new ConcurrentHashMap<>();

    @Autowired
    public TaskSchedulerJobControl(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public void registerRecurring(Runnable task, Duration interval) {
        synchronized (recurringLock) {
            cancelRecurringFuture();
            this.recurringTask = task;
            this.recurringInterval = interval;
            this.paused = false;
            startRecurring();
        }
        logger.info("Registered recurring tick every {} minutes", interval.toMinutes());
    }

    @Override
    public void pauseRecurring() {
        synchronized (recurringLock) {
            if (paused) {
                return;
            }
            cancelRecurringFuture();
            paused = true;
        }
        logger.info("Recurring tick paused");
    }

    @Override
    public void resumeRecurring() {
        synchronized (recurringLock) {
            if (!paused) {
                return;
            }
            paused = false;
            startRecurring();
        }
        logger.info("Recurring tick resumed");
    }

    @Override
    public void rescheduleRecurring(Duration interval) {
        synchronized (recurringLock) {
            this.recurringInterval = interval;
            if (paused) {
                return;
            }
            cancelRecurringFuture();
            startRecurring();
        }
        logger.info("Recurring tick rescheduled to every {} minutes", interval.toMinutes());
    }

    @Override
    public boolean isRecurringPaused() {
        synchronized (recurringLock) {
            return paused;
        }
    }

    @Override
    public void scheduleOnce(String key, Instant at, Runnable callback) {
        OnceJob job = new OnceJob();
        OnceJob previous = onceJobs.put(key, job);
        if (previous != null) {
            previous.cancel();
        }
        // The entry is removed before running so a callback can re-schedule its own key.
        job.future = taskScheduler.schedule(() -> {
            if (job.cancelled) {
                return;
            }
            onceJobs.remove(key, job);
            callback.run();
        }, at);
        logger.debug("Scheduled one-shot job {} at {}", key, at);
    }

    @Override
    public void cancelOnce(String key) {
        OnceJob job = onceJobs.remove(key);
        if (job != null) {
            job.cancel();
            logger.debug("Cancelled one-shot job {}", key);
        }
    }

    @Override
    public Set<String> scheduledOnceKeys() {
        return Set.copyOf(onceJobs.keySet());
    }

    private void startRecurring() {
        if (recurringTask == null) {
            logger.warn("No recurring task registered, nothing to start");
            return;
        }
        recurringFuture = taskScheduler.scheduleWithFixedDelay(
                recurringTask, clock.instant().plus(recurringInterval), recurringInterval);
    }

    private void cancelRecurringFuture() {
        if (recurringFuture != null) {
            recurringFuture.cancel(false);
            recurringFuture = null;
        }
    }

    private static final class OnceJob {
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
