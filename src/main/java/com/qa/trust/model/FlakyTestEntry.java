package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A test flagged as flaky over the recent run window")
public class FlakyTestEntry {

    @Schema(example = "tests/test_cache.py::test_eviction")
    private String testId;

    @Schema(description = "1 - |passes - failures| / window size, 3 decimals", example = "0.8")
    private double flakinessScore;

    @Schema(description = "Passes / window size", example = "0.6")
    private double passRate;

    @Schema(description = "Failures / window size", example = "0.4")
    private double failRate;

    @Schema(description = "Outcomes in the window", example = "10")
    private int totalRuns;

    @Schema(description = "Most recent outcomes, oldest first", example = "PFPPFPFPPF")
    private String recentPattern;

    @Schema(example = "failed")
    private TestOutcome lastOutcome;

    @Schema(description = "Detection time in epoch milliseconds")
    private long detectedAt;
}
