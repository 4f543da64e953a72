package com.ranquality.exception;

import lombok.Getter;

@Getter
public abstract class RanQualityException extends RuntimeException {
    private final String errorCode;
    protected RanQualityException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected RanQualityException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
