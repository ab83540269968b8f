package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Full trust analysis of one test run for one project")
public class TrustAssessment {

    String project;

    ImmutableRecord record;

    @Schema(description = "Claim verification result; null when no claim was supplied")
    DetectionResult claimDetection;

    SignalBundle signals;

    DeceptionScore deceptionScore;

    @Schema(description = "Tests currently flagged flaky for the project")
    List<FlakyTestEntry> flakyTests;

    @Schema(description = "False when the run history could not be persisted")
    boolean historyPersisted;

    @Schema(description = "Computed ingestion awaiting a persistence retry; null once persisted")
    IngestionResult pendingIngestion;

    @Schema(description = "False when a detection could not be appended to the project's detection log")
    boolean detectionLogPersisted;

    @Schema(description = "Detections counted in the project metrics but missing from the detection log")
    List<DetectionEvent> unloggedDetections;
}
