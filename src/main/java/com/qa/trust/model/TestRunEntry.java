package com.qa.trust.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-test slice of a persisted run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestRunEntry {
    private TestOutcome outcome;
    private double duration;
    private String error;
}
