package com.library.circulation.exception;

/**
 * Base type for request rejections raised by the borrowing lifecycle. Each subclass carries
 * a stable {@link #getCode() code} that clients can branch on without parsing the message.
 * None of these are retried by the service.
 */
public abstract class CirculationException extends RuntimeException {

    private final String code;

    protected CirculationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
