package com.ttennebkram.stylize.error;

/**
 * The batch input location could not be enumerated at all.
 */
public class DiscoveryException extends StylizeException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
