package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single executed test case.
 * ERROR counts as a failure everywhere: it blocks deployment and feeds the flakiness window as F.
 */
public enum TestOutcome {
    PASSED("passed", 'P'),
    FAILED("failed", 'F'),
    SKIPPED("skipped", 'S'),
    ERROR("error", 'F');

    private final String value;
    private final char letter;

    TestOutcome(String value, char letter) {
        this.value = value;
        this.letter = letter;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public char getLetter() {
        return letter;
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }

    @JsonCreator
    public static TestOutcome fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Outcome must not be null");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "passed":
            case "pass":
            case "success":
                return PASSED;
            case "failed":
            case "fail":
            case "failure":
                return FAILED;
            case "skipped":
            case "skip":
                return SKIPPED;
            case "error":
                return ERROR;
            default:
                throw new IllegalArgumentException("Unknown test outcome: " + raw);
        }
    }
}
