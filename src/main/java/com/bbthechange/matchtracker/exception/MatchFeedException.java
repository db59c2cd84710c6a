package com.bbthechange.matchtracker.exception;

/**
 * Exception thrown when the upstream match feed cannot be read.
 * Callers treat every error type as transient; RetryableFetcher decides whether to try again.
 */
public class MatchFeedException extends RuntimeException {

    private final ErrorType errorType;
    private final String eventId;

    public enum ErrorType {
        /**
         * Upstream answered with a non-2xx status other than 429.
         */
        HTTP_ERROR,

        /**
         * Upstream answered 429.
         */
        RATE_LIMITED,

        /**
         * Body could not be mapped to feed DTOs.
         */
        PARSE_ERROR,

        /**
         * Connection failure, timeout or interrupted request.
         */
        NETWORK_ERROR
    }

    public MatchFeedException(ErrorType errorType, String eventId, String message) {
        super(message);
        this.errorType = errorType;
        this.eventId = eventId;
    }

    public MatchFeedException(ErrorType errorType, String eventId, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.eventId = eventId;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getEventId() {
        return eventId;
    }

    public static MatchFeedException httpError(String eventId, int statusCode) {
        return new MatchFeedException(
                ErrorType.HTTP_ERROR,
                eventId,
                "Match feed returned status " + statusCode + " for event " + eventId
        );
    }

    public static MatchFeedException rateLimited(String eventId) {
        return new MatchFeedException(
                ErrorType.RATE_LIMITED,
                eventId,
                "Rate limited by match feed for event " + eventId
        );
    }

    public static MatchFeedException parseError(String eventId, Throwable cause) {
        return new MatchFeedException(
                ErrorType.PARSE_ERROR,
                eventId,
                "Could not parse match feed response for event " + eventId,
                cause
        );
    }

    public static MatchFeedException networkError(String eventId, Throwable cause) {
        return new MatchFeedException(
                ErrorType.NETWORK_ERROR,
                eventId,
                "Match feed unreachable for event " + eventId,
                cause
        );
    }
}
