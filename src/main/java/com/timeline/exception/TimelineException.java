package com.timeline.exception;

/**
 * Base exception for the timeline engine.
 */
public class TimelineException extends RuntimeException {

    public TimelineException(String message) {
        super(message);
    }

    public TimelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
