package com.speckle.error;

// A file list could not be fully indexed.
public class OrderingException extends CalibrationException {

    public OrderingException(String message) {
        super(message);
    }

    public OrderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
