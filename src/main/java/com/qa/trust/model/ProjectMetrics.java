package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detection counters of one project. Mutated only by the alert monitor while it holds the
 * project's lock; everyone else works on {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accumulated detection metrics of a project")
public class ProjectMetrics {

    private String project;

    @Schema(description = "Claim checks and deception scores recorded")
    private long totalChecks;

    @Schema(description = "Detections since the last alert")
    private int hallucinationsDetected;

    @Schema(description = "Detections since startup; never reset")
    private long lifetimeDetections;

    @Builder.Default
    private Map<Severity, Long> severityBreakdown = new EnumMap<>(Severity.class);

    @Builder.Default
    private Map<String, Long> patternBreakdown = new LinkedHashMap<>();

    private long lastAlertAt;

    public static ProjectMetrics forProject(String project) {
        return ProjectMetrics.builder().project(project).build();
    }

    public void incrementSeverity(Severity severity) {
        severityBreakdown.merge(severity, 1L, Long::sum);
    }

    public void incrementPattern(String pattern) {
        patternBreakdown.merge(pattern, 1L, Long::sum);
    }

    public ProjectMetrics copy() {
        Map<Severity, Long> severities = new EnumMap<>(Severity.class);
        severities.putAll(severityBreakdown);
        return ProjectMetrics.builder()
                .project(project)
                .totalChecks(totalChecks)
                .hallucinationsDetected(hallucinationsDetected)
                .lifetimeDetections(lifetimeDetections)
                .severityBreakdown(severities)
                .patternBreakdown(new LinkedHashMap<>(patternBreakdown))
                .lastAlertAt(lastAlertAt)
                .build();
    }
}
