package com.ttennebkram.stylize.error;

/**
 * Base class for all engine failures.
 * Subclasses tell callers whether the failure is fatal or can be contained.
 */
public class StylizeException extends RuntimeException {

    public StylizeException(String message) {
        super(message);
    }

    public StylizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
