package com.bbthechange.matchtracker.service;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.dto.FetchOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs a data source call with bounded retries and linear backoff
 * (base delay times the attempt number). Exhausted retries come back as a failed
 * FetchOutcome, never as an exception.
 */
@Component
public class RetryableFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RetryableFetcher.class);

    private final int maxRetries;
    private final long baseDelayMs;
    private final MeterRegistry meterRegistry;

    @Autowired
    public RetryableFetcher(TrackerProperties properties, MeterRegistry meterRegistry) {
        this(properties.getFetch().getMaxRetries(), properties.getFetch().getBaseDelay().toMillis(), meterRegistry);
    }

    /**
     * Package-private constructor for testing.
     */
    RetryableFetcher(int maxRetries, long baseDelayMs, MeterRegistry meterRegistry) {
        this.maxRetries = Math.max(1, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.meterRegistry = meterRegistry;
    }

    public <T> FetchOutcome<T> fetch(String operation, Callable<List<T>> call) {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                List<T> data = call.call();
                meterRegistry.counter("tracker_fetch_total", "status", "success").increment();
                if (attempt > 1) {
                    logger.info("{} succeeded on attempt {}/{}", operation, attempt, maxRetries);
                }
                return FetchOutcome.success(data, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("{} interrupted on attempt {}", operation, attempt);
                meterRegistry.counter("tracker_fetch_total", "status", "error").increment();
                return FetchOutcome.failure(attempt);
            } catch (Exception e) {
                lastException = e;
                meterRegistry.counter("tracker_fetch_total", "status", "retry").increment();

                if (attempt < maxRetries) {
                    long delayMs = baseDelayMs * attempt;
                    logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms",
                            operation, attempt, maxRetries, e.getMessage(), delayMs);
                    if (!sleep(delayMs)) {
                        meterRegistry.counter("tracker_fetch_total", "status", "error").increment();
                        return FetchOutcome.failure(attempt);
                    }
                }
            }
        }

        logger.warn("{} failed after {} attempts", operation, maxRetries, lastException);
        meterRegistry.counter("tracker_fetch_total", "status", "error").increment();
        return FetchOutcome.failure(maxRetries);
    }

    /**
     * Sleep between attempts. Returns false when interrupted.
     * Package-private for testing.
     */
    boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting to retry");
            return false;
        }
    }
}
