package com.vigil.service.core.error;

/** The requested method is not registered or is currently unavailable. Never replaced by another method. */
public class DetectorUnavailableException extends DetectionException {

    public static final String CODE = "detector-unavailable";

    private final String method;

    public DetectorUnavailableException(String method, String message) {
        super(CODE, message);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
