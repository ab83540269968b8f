package com.qa.trust.service;

import com.qa.trust.config.MetricsConfig;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.exception.StorageException;
import com.qa.trust.model.Alert;
import com.qa.trust.model.DeceptionScore;
import com.qa.trust.model.DetectionEvent;
import com.qa.trust.model.DetectionResult;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.ProjectMetrics;
import com.qa.trust.model.Severity;
import com.qa.trust.model.SignalType;
import com.qa.trust.model.TrustTier;
import com.qa.trust.repository.DetectionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Accumulates detection counters per project and fires an {@link Alert} each time a
 * project's detections since the last alert reach the threshold.
 * <p>
 * Counters are updated and the threshold is checked atomically per project; callbacks run
 * afterwards, in registration order, outside the project lock.
 */
@Service
public class AlertMonitor {

    private static final Logger log = LoggerFactory.getLogger(AlertMonitor.class);

    private final ProjectMetricsStore metricsStore;
    private final DetectionLogRepository detectionLogRepository;
    private final TrustConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final CopyOnWriteArrayList<AlertCallback> callbacks = new CopyOnWriteArrayList<>();

    public AlertMonitor(ProjectMetricsStore metricsStore, DetectionLogRepository detectionLogRepository,
                        TrustConfig config, MetricsConfig metricsConfig, Clock clock,
                        List<AlertCallback> alertCallbacks) {
        this.metricsStore = metricsStore;
        this.detectionLogRepository = detectionLogRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (AlertCallback callback : alertCallbacks) {
            addAlertCallback(callback);
        }
    }

    public void addAlertCallback(AlertCallback callback) {
        callbacks.add(callback);
        log.info("Registered alert callback: {}", callback.getName());
    }

    public boolean removeAlertCallback(AlertCallback callback) {
        return callbacks.remove(callback);
    }

    /**
     * Record a claim check. Any discrepancy counts as one detection.
     *
     * @return the alert fired by this call, if any
     * @throws StorageException when the detection log could not be appended; counters stay updated
     */
    public Optional<Alert> recordClaimCheck(String project, DetectionResult result, Map<String, Object> context) {
        List<Finding> findings = new ArrayList<>();
        for (Discrepancy d : result.getDiscrepancies()) {
            findings.add(new Finding(d.getKind().getCode(), d.getSeverity()));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (context != null) {
            details.putAll(context);
        }
        details.put("verified", result.isVerified());
        details.put("discrepancy_count", result.discrepancyCount());

        return record(project, DetectionEvent.SOURCE_CLAIM_CHECK, findings, result.getTrustScore(), details);
    }

    /**
     * Record a deception score. Indicators, or a tier below trusted, count as one detection.
     */
    public Optional<Alert> recordDeceptionScore(String project, DeceptionScore score) {
        List<Finding> findings = new ArrayList<>();
        for (SignalType indicator : score.getIndicators()) {
            findings.add(new Finding(indicator.getCode(), indicator.getSeverity()));
        }
        if (findings.isEmpty() && score.getTier() != TrustTier.TRUSTED) {
            Severity severity = score.getTier() == TrustTier.DECEPTIVE ? Severity.HIGH : Severity.MEDIUM;
            findings.add(new Finding("tier_" + score.getTier().getValue(), severity));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("overall_deception_score", score.getOverallDeceptionScore());
        details.put("tier", score.getTier().getValue());

        return record(project, DetectionEvent.SOURCE_DECEPTION_SCORE, findings, score.getTrustScore(), details);
    }

    public ProjectMetrics getMetrics(String project) {
        return metricsStore.snapshot(project);
    }

    public Map<String, ProjectMetrics> getAllMetrics() {
        return metricsStore.snapshotAll();
    }

    private Optional<Alert> record(String project, String source, List<Finding> findings,
                                   double trustScore, Map<String, Object> details) {
        boolean detected = !findings.isEmpty();
        Severity highest = findings.stream().map(Finding::severity).min(Enum::compareTo).orElse(null);

        DetectionEvent event = detected ? DetectionEvent.builder()
                .timestamp(DateTimeFormatter.ISO_INSTANT.format(clock.instant()))
                .project(project)
                .source(source)
                .severity(highest)
                .patterns(findings.stream().map(Finding::pattern).toList())
                .trustScore(trustScore)
                .context(details)
                .build() : null;

        Outcome outcome = metricsStore.update(project, metrics -> {
            metrics.setTotalChecks(metrics.getTotalChecks() + 1);
            if (!detected) {
                return new Outcome(null, null);
            }

            metrics.setHallucinationsDetected(metrics.getHallucinationsDetected() + 1);
            metrics.setLifetimeDetections(metrics.getLifetimeDetections() + 1);
            for (Finding finding : findings) {
                metrics.incrementSeverity(finding.severity());
                metrics.incrementPattern(finding.pattern());
            }

            IOException logFailure = null;
            try {
                detectionLogRepository.append(project, event);
            } catch (IOException e) {
                logFailure = e;
            }

            return new Outcome(checkThreshold(metrics), logFailure);
        });

        if (detected) {
            if (highest == Severity.CRITICAL) {
                log.error("Critical detection for project {} ({}): {}", project, source, event.getPatterns());
            } else {
                log.info("Detection for project {} ({}, {}): {}", project, source,
                        highest.getValue(), event.getPatterns());
            }
        }

        outcome.alert().ifPresent(this::deliver);

        if (outcome.logFailure() != null) {
            metricsConfig.recordStorageFailure("detection_log");
            log.error("Failed to append detection log for project {}: {}",
                    project, outcome.logFailure().getMessage(), outcome.logFailure());
            throw new StorageException("Failed to append detection log for project " + project,
                    outcome.logFailure(), event);
        }
        return outcome.alert();
    }

    // caller holds the project's metrics lock
    private Optional<Alert> checkThreshold(ProjectMetrics metrics) {
        TrustConfig.Alerts alerts = config.getAlerts();
        if (!alerts.isEnabled() || metrics.getHallucinationsDetected() < alerts.getThreshold()) {
            return Optional.empty();
        }

        ProjectMetrics snapshot = metrics.copy();
        long now = clock.millis();
        metrics.setHallucinationsDetected(0);
        metrics.setLastAlertAt(now);

        return Optional.of(Alert.builder()
                .project(snapshot.getProject())
                .timestamp(now)
                .hallucinationCount(snapshot.getHallucinationsDetected())
                .threshold(alerts.getThreshold())
                .totalChecks(snapshot.getTotalChecks())
                .severityBreakdown(Collections.unmodifiableMap(snapshot.getSeverityBreakdown()))
                .patternBreakdown(Collections.unmodifiableMap(snapshot.getPatternBreakdown()))
                .build());
    }

    private void deliver(Alert alert) {
        metricsConfig.recordAlert(alert.getProject());
        log.warn("Alert for project {}: {} detections reached threshold {} ({} checks total)",
                alert.getProject(), alert.getHallucinationCount(), alert.getThreshold(), alert.getTotalChecks());

        for (AlertCallback callback : callbacks) {
            try {
                callback.onAlert(alert);
            } catch (Exception e) {
                metricsConfig.recordCallbackFailure(callback.getName());
                log.error("Alert callback {} failed for project {}: {}",
                        callback.getName(), alert.getProject(), e.getMessage(), e);
            }
        }
    }

    private record Finding(String pattern, Severity severity) {}

    private record Outcome(Optional<Alert> alert, IOException logFailure) {
        Outcome {
            alert = alert == null ? Optional.empty() : alert;
        }
    }
}
