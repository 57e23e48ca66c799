package com.timeline.exception;

/**
 * Exception thrown when an anchor date is missing or cannot be parsed.
 */
public class InvalidAnchorDateException extends TimelineException {

    public InvalidAnchorDateException(String message) {
        super(message);
    }

    public InvalidAnchorDateException(String message, Throwable cause) {
        super(message, cause);
    }
}
