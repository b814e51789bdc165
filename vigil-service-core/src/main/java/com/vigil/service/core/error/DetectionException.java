package com.vigil.service.core.error;

/** Base of the detection error taxonomy. Each subtype carries a stable, client-facing code. */
public abstract class DetectionException extends RuntimeException {

    private final String code;

    protected DetectionException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected DetectionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
