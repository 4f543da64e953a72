package com.ranquality.exception;

public class DataSourceUnavailableException extends RanQualityException {
    public DataSourceUnavailableException(String source, Throwable cause) {
        super("DATA_SOURCE_UNAVAILABLE",
              "The " + source + " is currently unavailable. Please try again later.",
              cause);
    }
}
