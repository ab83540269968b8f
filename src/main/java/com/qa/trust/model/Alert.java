package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "Threshold-crossing snapshot of a project's detection metrics")
public class Alert {

    @Schema(example = "payments-service")
    String project;

    @Schema(description = "Trigger time in epoch milliseconds")
    long timestamp;

    @Schema(description = "Detections counted since the previous alert", example = "5")
    int hallucinationCount;

    @Schema(description = "The threshold that was reached", example = "5")
    int threshold;

    long totalChecks;

    Map<Severity, Long> severityBreakdown;

    Map<String, Long> patternBreakdown;
}
