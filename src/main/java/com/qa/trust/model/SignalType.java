package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Heuristic deception signals. Ratio signals are already in [0,1]; count signals are
 * normalized by the aggregator before weighting.
 */
public enum SignalType {
    MOCK_ABUSE("mock_abuse", Severity.CRITICAL, false),
    SKELETON_CODE("skeleton_code", Severity.HIGH, false),
    HONEYPOT_VIOLATION("honeypot_violation", Severity.CRITICAL, false),
    INSTANT_TESTS("instant_tests", Severity.HIGH, false),
    HALLUCINATIONS("hallucinations", Severity.HIGH, true),
    CLAIM_FAILURES("claim_failures", Severity.MEDIUM, true);

    private final String code;
    private final Severity severity;
    private final boolean count;

    SignalType(String code, Severity severity, boolean count) {
        this.code = code;
        this.severity = severity;
        this.count = count;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isCount() {
        return count;
    }
}
