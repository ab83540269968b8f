package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Classified error of a failing test case")
public class ErrorSummary {

    @Schema(description = "Inferred error category", example = "assertion_failure")
    ErrorCategory category;

    @Schema(description = "Error message, truncated to the configured limit")
    String message;
}
