package com.studiomanagement.booking.exception;

import lombok.Getter;

@Getter
public class StudioException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public StudioException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public StudioException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public StudioException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
