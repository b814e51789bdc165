package com.vigil.service.core.error;

/** A detector's fit or score step failed on pathological input. Fails that series only. */
public class ComputationException extends DetectionException {

    public static final String CODE = "computation-error";

    public ComputationException(String message) {
        super(CODE, message);
    }

    public ComputationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
