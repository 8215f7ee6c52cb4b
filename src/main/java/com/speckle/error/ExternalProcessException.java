package com.speckle.error;

// The reconstruction process could not be spawned.
public class ExternalProcessException extends CalibrationException {

    public ExternalProcessException(String message) {
        super(message);
    }

    public ExternalProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
