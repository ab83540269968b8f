package com.qa.trust.service;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.ProjectMetrics;
import com.qa.trust.repository.DetectionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hourly advisory snapshot of every project's detection metrics. Only reads counters, so it
 * can be disabled or skipped without losing data.
 */
@Service
public class SummaryReportService {

    private static final Logger log = LoggerFactory.getLogger(SummaryReportService.class);
    private static final DateTimeFormatter FILE_HOUR = DateTimeFormatter.ofPattern("yyyyMMdd_HH").withZone(ZoneOffset.UTC);

    private final ProjectMetricsStore metricsStore;
    private final DetectionLogRepository detectionLogRepository;
    private final TrustConfig config;
    private final Clock clock;

    public SummaryReportService(ProjectMetricsStore metricsStore, DetectionLogRepository detectionLogRepository,
                                TrustConfig config, Clock clock) {
        this.metricsStore = metricsStore;
        this.detectionLogRepository = detectionLogRepository;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(cron = "${trust.summary.cron:0 0 * * * *}")
    public void writeHourlySummary() {
        if (!config.getSummary().isEnabled()) {
            return;
        }
        try {
            Path file = writeSummary();
            log.info("Wrote detection summary {}", file);
        } catch (IOException e) {
            log.error("Failed to write detection summary: {}", e.getMessage(), e);
        }
    }

    public Path writeSummary() throws IOException {
        String fileName = "hallucination_summary_" + FILE_HOUR.format(clock.instant()) + ".json";
        return detectionLogRepository.writeSummary(fileName, buildSummary());
    }

    public Map<String, Object> buildSummary() {
        Map<String, Object> projects = new LinkedHashMap<>();
        for (Map.Entry<String, ProjectMetrics> e : metricsStore.snapshotAll().entrySet()) {
            ProjectMetrics m = e.getValue();
            double rate = m.getTotalChecks() == 0
                    ? 0.0
                    : Math.round(m.getLifetimeDetections() * 10000.0 / m.getTotalChecks()) / 100.0;

            List<Map<String, Object>> topPatterns = m.getPatternBreakdown().entrySet().stream()
                    .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                            .thenComparing(Map.Entry.comparingByKey()))
                    .limit(config.getSummary().getTopPatterns())
                    .map(p -> {
                        Map<String, Object> entry = new LinkedHashMap<>();
                        entry.put("pattern", p.getKey());
                        entry.put("count", p.getValue());
                        return entry;
                    })
                    .toList();

            Map<String, Object> project = new LinkedHashMap<>();
            project.put("total_checks", m.getTotalChecks());
            project.put("detections", m.getLifetimeDetections());
            project.put("hallucination_rate", rate);
            project.put("top_patterns", topPatterns);
            projects.put(e.getKey(), project);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("generated_at", DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        summary.put("projects", projects);
        return summary;
    }
}
