package com.ttennebkram.stylize.error;

/**
 * A single batch job failed. Absorbed at the batch boundary and reported in the outcome list.
 */
public class JobFailureException extends StylizeException {

    public JobFailureException(String message) {
        super(message);
    }

    public JobFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
