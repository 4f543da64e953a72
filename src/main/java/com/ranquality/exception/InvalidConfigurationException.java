package com.ranquality.exception;

public class InvalidConfigurationException extends RanQualityException {
    public InvalidConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }
}
