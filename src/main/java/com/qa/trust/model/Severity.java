package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered most severe first; {@link #compareTo} therefore sorts critical before low.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || this.ordinal() < other.ordinal();
    }
}
