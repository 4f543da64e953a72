package com.ranquality.domain.metric;

public enum Technology {
    UMTS,
    LTE,
    NR;

    public static Technology fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("technology label is required");
        }
        return switch (label.trim().toUpperCase()) {
            case "UMTS", "3G" -> UMTS;
            case "LTE", "4G" -> LTE;
            case "NR", "5G" -> NR;
            default -> throw new IllegalArgumentException("Unknown technology: " + label);
        };
    }
}
