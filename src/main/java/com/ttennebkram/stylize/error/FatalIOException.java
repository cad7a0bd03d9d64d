package com.ttennebkram.stylize.error;

/**
 * An input could not be read or an output could not be written.
 * Aborts the affected job, or the whole batch when raised during setup.
 */
public class FatalIOException extends StylizeException {

    public FatalIOException(String message) {
        super(message);
    }

    public FatalIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
