package com.qa.trust.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content of a project's flaky-tests file, regenerated on every ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlakyTestSnapshot {

    private long updatedAt;

    @Builder.Default
    private Map<String, FlakyTestEntry> tests = new LinkedHashMap<>();
}
