package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One line of a project's append-only detection log.
 */
@Value
@Builder
@Jacksonized
public class DetectionEvent {

    public static final String SOURCE_CLAIM_CHECK = "claim_check";
    public static final String SOURCE_DECEPTION_SCORE = "deception_score";

    @JsonProperty("timestamp")
    String timestamp;

    @JsonProperty("project")
    String project;

    @JsonProperty("source")
    String source;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("patterns")
    List<String> patterns;

    @JsonProperty("trust_score")
    double trustScore;

    @JsonProperty("context")
    Map<String, Object> context;
}
