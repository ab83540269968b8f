package com.qa.trust.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthPoint {
    private String runId;
    private long timestamp;
    private int total;
    private int passed;
    /** Failed plus errored cases. */
    private int failed;
    private int skipped;
    private double successRate;
    private double duration;
}
