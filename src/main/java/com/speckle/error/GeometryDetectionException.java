package com.speckle.error;

// Overscan detection or header dimensions produced an unusable frame shape.
public class GeometryDetectionException extends CalibrationException {

    public GeometryDetectionException(String message) {
        super(message);
    }

    public GeometryDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
