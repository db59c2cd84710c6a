package com.bbthechange.matchtracker.dto;

/**
 * Statistics of one tick.
 */
public class TickResult {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_IDLE = "idle";
    public static final String STATUS_SKIPPED = "skipped";
    public static final String STATUS_ERROR = "error";

    private String status;
    private int activeEvents;
    private int startNotifications;
    private int resultNotifications;
    private int withheldResults;
    private int pendingDeliveries;
    private int fetchErrors;
    private int intervalMinutes;
    private long durationMs;

    public TickResult() {
    }

    private TickResult(String status, int activeEvents, int intervalMinutes, long durationMs) {
        this.status = status;
        this.activeEvents = activeEvents;
        this.intervalMinutes = intervalMinutes;
        this.durationMs = durationMs;
    }

    public static TickResult success(int activeEvents, int intervalMinutes, long durationMs) {
        return new TickResult(STATUS_SUCCESS, activeEvents, intervalMinutes, durationMs);
    }

    /**
     * No event is active; polling was paused and nothing was fetched.
     */
    public static TickResult idle(long durationMs) {
        return new TickResult(STATUS_IDLE, 0, 0, durationMs);
    }

    /**
     * Another tick was already running.
     */
    public static TickResult skipped() {
        return new TickResult(STATUS_SKIPPED, 0, 0, 0);
    }

    public static TickResult error(long durationMs) {
        return new TickResult(STATUS_ERROR, 0, 0, durationMs);
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public int getActiveEvents() {
        return activeEvents;
    }

    public void setActiveEvents(int activeEvents) {
        this.activeEvents = activeEvents;
    }

    public int getStartNotifications() {
        return startNotifications;
    }

    public void setStartNotifications(int startNotifications) {
        this.startNotifications = startNotifications;
    }

    public int getResultNotifications() {
        return resultNotifications;
    }

    public void setResultNotifications(int resultNotifications) {
        this.resultNotifications = resultNotifications;
    }

    public int getWithheldResults() {
        return withheldResults;
    }

    public void setWithheldResults(int withheldResults) {
        this.withheldResults = withheldResults;
    }

    public int getPendingDeliveries() {
        return pendingDeliveries;
    }

    public void setPendingDeliveries(int pendingDeliveries) {
        this.pendingDeliveries = pendingDeliveries;
    }

    public int getFetchErrors() {
        return fetchErrors;
    }

    public void setFetchErrors(int fetchErrors) {
        this.fetchErrors = fetchErrors;
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    @Override
    public String toString() {
        return "TickResult{" +
                "status='" + status + '\'' +
                ", activeEvents=" + activeEvents +
                ", startNotifications=" + startNotifications +
                ", resultNotifications=" + resultNotifications +
                ", withheldResults=" + withheldResults +
                ", pendingDeliveries=" + pendingDeliveries +
                ", fetchErrors=" + fetchErrors +
                ", intervalMinutes=" + intervalMinutes +
                ", durationMs=" + durationMs +
                '}';
    }
}
