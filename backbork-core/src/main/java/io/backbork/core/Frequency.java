package io.backbork.core;

import java.util.Locale;

public enum Frequency {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Case-insensitive lookup, e.g. "daily".
     */
    public static Frequency parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("frequency must not be blank");
        }
        try {
            return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported frequency: " + value);
        }
    }
}
