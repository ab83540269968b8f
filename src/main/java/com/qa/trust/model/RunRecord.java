package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One ingested run as kept in the project history")
public class RunRecord {

    @Schema(example = "run-20260115-101530")
    private String runId;

    @Schema(description = "Ingestion time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    private int total;
    private int passed;
    @Schema(description = "Failed plus errored cases")
    private int failed;
    private int skipped;

    @Schema(description = "Run duration in seconds")
    private double duration;

    @Builder.Default
    private Map<String, TestRunEntry> tests = new LinkedHashMap<>();

    public double successRate() {
        return total == 0 ? 0.0 : Math.round(passed * 10000.0 / total) / 100.0;
    }
}
