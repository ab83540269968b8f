package com.qa.trust.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything one ingestion computed. Returned even when persisting it failed, so the
 * caller can retry the write without recomputing.
 */
@Value
@Builder(toBuilder = true)
public class IngestionResult {
    String project;
    RunRecord run;
    List<RunRecord> history;
    Map<String, FlakyTestEntry> flakyTests;
    boolean persisted;
}
