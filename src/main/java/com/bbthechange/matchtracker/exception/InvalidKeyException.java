package com.bbthechange.matchtracker.exception;

/**
 * Thrown by TrackerKeyFactory when an identifier cannot be used as a key part.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
