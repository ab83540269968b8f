package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A contradiction between a claim and the record it describes")
public class Discrepancy {

    @Schema(example = "missing_failure_count")
    DiscrepancyKind kind;

    @Schema(example = "critical")
    Severity severity;

    @Schema(description = "What the claim should have stated", example = "5")
    String expected;

    @Schema(description = "Human-readable explanation")
    String explanation;
}
