package com.dispatchqueue.core;

import java.util.Locale;

// Severity of a chat notification, drives the embed colour
public enum Severity {
    INFO(0x3498db),
    WARNING(0xf39c12),
    ERROR(0xe74c3c);

    private final int color;

    Severity(int color) {
        this.color = color;
    }

    public int getColor() {
        return color;
    }

    // Lenient parse of stored or producer values; null or blank means INFO
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown severity: " + value);
        }
    }
}
