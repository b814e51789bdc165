package com.vigil.service.core.error;

/** Malformed request envelope. Rejects the whole request before any series is processed. */
public class InvalidInputException extends DetectionException {

    public static final String CODE = "invalid-input";

    public InvalidInputException(String message) {
        super(CODE, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
