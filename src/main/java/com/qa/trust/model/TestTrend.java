package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome and duration statistics of one test over a day window")
public class TestTrend {

    private String project;
    private String testId;

    @Schema(description = "Length of the window in days", example = "7")
    private int periodDays;

    @Schema(description = "Runs in the window that contained the test")
    private int totalRuns;

    @Builder.Default
    private Map<TestOutcome, Integer> outcomes = new EnumMap<>(TestOutcome.class);

    @Schema(description = "Passed runs as a percentage, 2 decimals", example = "85.71")
    private double successRate;

    @Schema(description = "Statistics over positive durations; null when none were recorded")
    private DurationStats durationStats;

    @Builder.Default
    @Schema(description = "Last 10 runs, oldest first")
    private List<TrendPoint> recentRuns = new ArrayList<>();

    @Schema(description = "Mean of the latest durations exceeds the overall mean by the configured factor")
    private boolean performanceRegression;

    @Schema(description = "Recent mean / overall mean when a regression was flagged", example = "2.1")
    private Double regressionFactor;
}
