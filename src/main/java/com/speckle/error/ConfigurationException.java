package com.speckle.error;

// A required directory, key or value is missing or malformed.
public class ConfigurationException extends CalibrationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
