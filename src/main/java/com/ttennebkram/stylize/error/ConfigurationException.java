package com.ttennebkram.stylize.error;

/**
 * Malformed or out-of-range settings. Fatal at construction time.
 */
public class ConfigurationException extends StylizeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
