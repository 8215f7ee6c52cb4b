package com.speckle.error;

// A required file list matched nothing.
public class DiscoveryException extends CalibrationException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
