package com.bbthechange.matchtracker.exception;

/**
 * Thrown when a subscription or notified-set store operation fails.
 * Wraps the underlying DynamoDB exception.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
