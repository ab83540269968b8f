package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One executed test case")
public class TestCaseResult {

    @Schema(description = "Test identifier, unique within a run", example = "tests/test_api.py::test_login")
    String id;

    @Schema(description = "Outcome of the test", example = "failed")
    TestOutcome outcome;

    @Schema(description = "Duration in seconds (non-negative)", example = "0.125")
    double duration;

    @Schema(description = "Error summary; null for passing and skipped tests")
    ErrorSummary error;
}
