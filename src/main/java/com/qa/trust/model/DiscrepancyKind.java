package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiscrepancyKind {
    MISSING_FAILURE_COUNT("missing_failure_count"),
    INCORRECT_SUCCESS_RATE("incorrect_success_rate"),
    FALSE_DEPLOYMENT_APPROVAL("false_deployment_approval"),
    MISSING_VERIFICATION("missing_verification"),
    APPROXIMATE_LANGUAGE("approximate_language"),
    IGNORED_FAILURES("ignored_failures"),
    MINIMIZED_FAILURES("minimized_failures");

    private final String code;

    DiscrepancyKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
