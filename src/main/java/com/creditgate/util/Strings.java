package com.creditgate.util;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Null-safe string helpers for values headed into logs, headers and metric tags.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    public static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    /**
     * Returns a non-null string for use as a metric tag or log field.
     * Null or blank input becomes "unknown".
     */
    @Nonnull
    public static String safe(@Nullable String value) {
        return isBlank(value) ? "unknown" : value;
    }

    /**
     * Cuts a value down to maxLength characters. Null stays null.
     */
    @Nullable
    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
