package com.bbthechange.matchtracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the match tracker polling loop.
 * Bound from the {@code tracker.*} namespace.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    /**
     * Zone used to resolve MM-DD dates and HH:MM match times.
     */
    @NotBlank
    private String timezone = "Asia/Shanghai";

    @Min(1)
    private int upcomingWindowHours = 24;
    @Min(0)
    private int endGraceDays = 1;
    @Min(0)
    private int overdueThresholdMinutes = 30;
    @Min(0)
    private int postLiveGraceMinutes = 30;

    @Min(1)
    private int minIntervalMinutes = 5;
    @Min(1)
    private int defaultIntervalMinutes = 5;
    @Min(1)
    private int longestIntervalMinutes = 180;
    @Valid
    @NotEmpty
    private List<IntervalStep> intervalSteps = defaultSteps();

    @NotNull
    private Duration startupDelay = Duration.ofSeconds(10);

    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Notifications notifications = new Notifications();

    private static List<IntervalStep> defaultSteps() {
        List<IntervalStep> steps = new ArrayList<>();
        steps.add(new IntervalStep(60, 5));
        steps.add(new IntervalStep(360, 15));
        steps.add(new IntervalStep(1440, 60));
        return steps;
    }

    /**
     * One row of the hint-to-interval table: hints up to {@code maxMinutesUntil}
     * poll every {@code intervalMinutes}.
     */
    public static class IntervalStep {
        @Min(0)
        private int maxMinutesUntil;
        @Min(1)
        private int intervalMinutes;

        public IntervalStep() {
        }

        public IntervalStep(int maxMinutesUntil, int intervalMinutes) {
            this.maxMinutesUntil = maxMinutesUntil;
            this.intervalMinutes = intervalMinutes;
        }

        public int getMaxMinutesUntil() {
            return maxMinutesUntil;
        }

        public void setMaxMinutesUntil(int maxMinutesUntil) {
            this.maxMinutesUntil = maxMinutesUntil;
        }

        public int getIntervalMinutes() {
            return intervalMinutes;
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }
    }

    public static class Fetch {
        @Min(1)
        private int maxRetries = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(2);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    public static class Notifications {
        /**
         * Delivery passes after which an unacknowledged result is marked anyway.
         */
        @Min(1)
        private int maxResultAttempts = 10;

        public int getMaxResultAttempts() {
            return maxResultAttempts;
        }

        public void setMaxResultAttempts(int maxResultAttempts) {
            this.maxResultAttempts = maxResultAttempts;
        }
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getUpcomingWindowHours() {
        return upcomingWindowHours;
    }

    public void setUpcomingWindowHours(int upcomingWindowHours) {
        this.upcomingWindowHours = upcomingWindowHours;
    }

    public int getEndGraceDays() {
        return endGraceDays;
    }

    public void setEndGraceDays(int endGraceDays) {
        this.endGraceDays = endGraceDays;
    }

    public int getOverdueThresholdMinutes() {
        return overdueThresholdMinutes;
    }

    public void setOverdueThresholdMinutes(int overdueThresholdMinutes) {
        this.overdueThresholdMinutes = overdueThresholdMinutes;
    }

    public int getPostLiveGraceMinutes() {
        return postLiveGraceMinutes;
    }

    public void setPostLiveGraceMinutes(int postLiveGraceMinutes) {
        this.postLiveGraceMinutes = postLiveGraceMinutes;
    }

    public int getMinIntervalMinutes() {
        return minIntervalMinutes;
    }

    public void setMinIntervalMinutes(int minIntervalMinutes) {
        this.minIntervalMinutes = minIntervalMinutes;
    }

    public int getDefaultIntervalMinutes() {
        return defaultIntervalMinutes;
    }

    public void setDefaultIntervalMinutes(int defaultIntervalMinutes) {
        this.defaultIntervalMinutes = defaultIntervalMinutes;
    }

    public int getLongestIntervalMinutes() {
        return longestIntervalMinutes;
    }

    public void setLongestIntervalMinutes(int longestIntervalMinutes) {
        this.longestIntervalMinutes = longestIntervalMinutes;
    }

    public List<IntervalStep> getIntervalSteps() {
        return intervalSteps;
    }

    public void setIntervalSteps(List<IntervalStep> intervalSteps) {
        this.intervalSteps = intervalSteps;
    }

    public Duration getStartupDelay() {
        return startupDelay;
    }

    public void setStartupDelay(Duration startupDelay) {
        this.startupDelay = startupDelay;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }
}
