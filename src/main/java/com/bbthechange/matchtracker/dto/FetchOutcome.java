package com.bbthechange.matchtracker.dto;

import java.util.List;

/**
 * Result of a retried fetch. An empty list with {@code failed == false} means upstream
 * legitimately has nothing; {@code failed == true} means every attempt failed.
 */
public class FetchOutcome<T> {

    private final List<T> data;
    private final boolean failed;
    private final int attempts;

    private FetchOutcome(List<T> data, boolean failed, int attempts) {
        this.data = data;
        this.failed = failed;
        this.attempts = attempts;
    }

    public static <T> FetchOutcome<T> success(List<T> data, int attempts) {
        return new FetchOutcome<>(data == null ? List.of() : List.copyOf(data), false, attempts);
    }

    public static <T> FetchOutcome<T> failure(int attempts) {
        return new FetchOutcome<>(List.of(), true, attempts);
    }

    public List<T> getData() {
        return data;
    }

    public boolean isFailed() {
        return failed;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "FetchOutcome{" +
                "size=" + data.size() +
                ", failed=" + failed +
                ", attempts=" + attempts +
                '}';
    }
}
