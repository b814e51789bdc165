package com.vigil.service.core.error;

/** A series is shorter than the chosen method's minimum. Fails that series only. */
public class InsufficientDataException extends DetectionException {

    public static final String CODE = "insufficient-data";

    private final String method;
    private final int required;
    private final int actual;

    public InsufficientDataException(String method, int required, int actual) {
        super(
                CODE,
                String.format(
                        "method '%s' requires at least %d points but the series has %d", method, required, actual));
        this.method = method;
        this.required = required;
        this.actual = actual;
    }

    public String getMethod() {
        return method;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
