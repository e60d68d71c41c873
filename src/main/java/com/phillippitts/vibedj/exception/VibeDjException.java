package com.phillippitts.vibedj.exception;

/**
 * Base exception for all vibe-dj application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VibeDjException extends RuntimeException {

    public VibeDjException(String message) {
        super(message);
    }

    public VibeDjException(String message, Throwable cause) {
        super(message, cause);
    }

    public VibeDjException(Throwable cause) {
        super(cause);
    }
}
