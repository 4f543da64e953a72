package com.ranquality.exception;

public class NeighborApiException extends RanQualityException {
    public NeighborApiException(String message) {
        super("NEIGHBOR_API_ERROR", message);
    }
}
