package com.timeline.exception;

/**
 * Exception thrown when a manual segment edit would break the phase chain.
 */
public class InvalidSegmentEditException extends TimelineException {

    public InvalidSegmentEditException(String message) {
        super(message);
    }
}
