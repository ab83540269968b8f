package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Fixed error taxonomy for failing cases. Declaration order is the match priority.
 */
public enum ErrorCategory {
    ASSERTION("assertion_failure", List.of("assertionerror", "assertion failed", "assert")),
    IMPORT("import_error", List.of("importerror", "modulenotfounderror", "no module named",
            "classnotfoundexception", "noclassdeffounderror")),
    TIMEOUT("timeout", List.of("timeouterror", "timeoutexception", "timed out", "timeout")),
    CONNECTION("connection_error", List.of("connectionerror", "connectexception",
            "connection refused", "connection reset")),
    UNKNOWN("unknown_error", List.of());

    private final String code;
    private final List<String> markers;

    ErrorCategory(String code, List<String> markers) {
        this.code = code;
        this.markers = markers;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public List<String> getMarkers() {
        return markers;
    }

    @JsonCreator
    public static ErrorCategory fromCode(String code) {
        for (ErrorCategory category : values()) {
            if (category.code.equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + code);
    }

    /**
     * Classify error text by substring match; first category in priority order wins.
     */
    public static ErrorCategory classify(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return UNKNOWN;
        }
        String lower = errorText.toLowerCase(Locale.ROOT);
        for (ErrorCategory category : values()) {
            for (String marker : category.markers) {
                if (lower.contains(marker)) {
                    return category;
                }
            }
        }
        return UNKNOWN;
    }
}
