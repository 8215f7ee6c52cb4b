package com.speckle.error;

// Root of the fatal conditions that abort a calibration run.
public class CalibrationException extends Exception {

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
