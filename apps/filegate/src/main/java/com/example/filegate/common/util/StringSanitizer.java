package com.example.filegate.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 256;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        if (sanitized.length() > maxLength) {
            return sanitized.substring(0, maxLength) + "...";
        }
        return sanitized;
    }

    public static boolean containsControlCharacters(@Nullable String value) {
        if (value == null) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
