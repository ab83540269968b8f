package com.qa.trust.service;

import com.qa.trust.config.MetricsConfig;
import com.qa.trust.engine.ClaimChecker;
import com.qa.trust.engine.ReportSignalExtractor;
import com.qa.trust.engine.record.HashVerifier;
import com.qa.trust.engine.record.RecordBuilder;
import com.qa.trust.engine.record.ReportParser;
import com.qa.trust.exception.StorageException;
import com.qa.trust.model.DeceptionScore;
import com.qa.trust.model.DetectionEvent;
import com.qa.trust.model.DetectionResult;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.ExternalSignals;
import com.qa.trust.model.FlakyTestEntry;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.IngestionResult;
import com.qa.trust.model.SignalBundle;
import com.qa.trust.model.TestRunReport;
import com.qa.trust.model.TrustAssessment;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point tying record building, claim checking, deception scoring, history tracking
 * and alerting together.
 */
@Service
public class TrustVerificationService {

    private static final Logger log = LoggerFactory.getLogger(TrustVerificationService.class);

    private final ReportParser reportParser;
    private final RecordBuilder recordBuilder;
    private final HashVerifier hashVerifier;
    private final ClaimChecker claimChecker;
    private final ReportSignalExtractor signalExtractor;
    private final SignalAggregator signalAggregator;
    private final FlakinessTracker flakinessTracker;
    private final AlertMonitor alertMonitor;
    private final MetricsConfig metricsConfig;

    public TrustVerificationService(ReportParser reportParser, RecordBuilder recordBuilder,
                                    HashVerifier hashVerifier, ClaimChecker claimChecker,
                                    ReportSignalExtractor signalExtractor, SignalAggregator signalAggregator,
                                    FlakinessTracker flakinessTracker, AlertMonitor alertMonitor,
                                    MetricsConfig metricsConfig) {
        this.reportParser = reportParser;
        this.recordBuilder = recordBuilder;
        this.hashVerifier = hashVerifier;
        this.claimChecker = claimChecker;
        this.signalExtractor = signalExtractor;
        this.signalAggregator = signalAggregator;
        this.flakinessTracker = flakinessTracker;
        this.alertMonitor = alertMonitor;
        this.metricsConfig = metricsConfig;
    }

    public ImmutableRecord buildRecord(String reportJson) {
        return buildRecord(reportParser.parse(reportJson));
    }

    public ImmutableRecord buildRecord(TestRunReport report) {
        ImmutableRecord record = recordBuilder.build(report);
        metricsConfig.recordRecordBuilt(record.getFacts().isDeploymentAllowed());
        return record;
    }

    public boolean verifyRecord(ImmutableRecord record) {
        boolean valid = hashVerifier.verify(record);
        metricsConfig.recordHashVerification(valid);
        return valid;
    }

    /**
     * Check a claim about a record and feed the result to the project's alert counters.
     *
     * @throws StorageException when the detection could not be logged; counters are already updated
     */
    @Observed(name = "claim.verify", contextualName = "verify-claim")
    public DetectionResult verifyClaim(String project, ImmutableRecord record, String claim) {
        DetectionResult result = checkClaim(record, claim);
        alertMonitor.recordClaimCheck(project, result, claimContext(record, claim));
        return result;
    }

    public TrustAssessment assess(String project, String reportJson, ExternalSignals externalSignals, String claim) {
        return assess(project, reportParser.parse(reportJson), externalSignals, claim);
    }

    /**
     * Full analysis of one run:
     * 1. Freeze the report into an immutable record
     * 2. Check the claim, when one is supplied
     * 3. Extract signals and compute the deception score
     * 4. Ingest the run into the project history and collect flaky tests
     *
     * Storage failures do not discard the analysis. Detections that could not be logged are
     * returned on the assessment, and a failed history write returns the computed ingestion
     * for {@link FlakinessTracker#retryPersist(IngestionResult)}.
     */
    @Observed(name = "trust.assess", contextualName = "assess-run")
    public TrustAssessment assess(String project, TestRunReport report, ExternalSignals externalSignals,
                                  String claim) {
        ImmutableRecord record = buildRecord(report);
        List<DetectionEvent> unlogged = new ArrayList<>();

        DetectionResult detection = null;
        if (claim != null) {
            DetectionResult claimResult = checkClaim(record, claim);
            recordDetection(project, unlogged,
                    () -> alertMonitor.recordClaimCheck(project, claimResult, claimContext(record, claim)));
            detection = claimResult;
        }

        SignalBundle signals = signalExtractor.extract(report, externalSignals, detection);
        DeceptionScore score = signalAggregator.aggregate(project, signals);
        metricsConfig.recordDeceptionScore(score.getTier().getValue(), score.getOverallDeceptionScore());
        recordDetection(project, unlogged, () -> alertMonitor.recordDeceptionScore(project, score));

        IngestionResult ingestion;
        try {
            ingestion = flakinessTracker.ingest(project, report, null);
        } catch (StorageException e) {
            ingestion = e.getPendingResult(IngestionResult.class);
            if (ingestion == null) {
                throw e;
            }
            log.warn("History for project {} not persisted; returning pending ingestion for retry", project);
        }

        List<FlakyTestEntry> flaky = new ArrayList<>(ingestion.getFlakyTests().values());
        flaky.sort(Comparator.comparingDouble(FlakyTestEntry::getFlakinessScore).reversed());

        log.info("Assessed project {}: failed={}, deception={}, tier={}, claim verified={}",
                project, record.getFacts().getFailedCount(), score.getOverallDeceptionScore(),
                score.getTier().getValue(), detection == null ? "n/a" : detection.isVerified());

        return TrustAssessment.builder()
                .project(project)
                .record(record)
                .claimDetection(detection)
                .signals(signals)
                .deceptionScore(score)
                .flakyTests(flaky)
                .historyPersisted(ingestion.isPersisted())
                .pendingIngestion(ingestion.isPersisted() ? null : ingestion)
                .detectionLogPersisted(unlogged.isEmpty())
                .unloggedDetections(List.copyOf(unlogged))
                .build();
    }

    private DetectionResult checkClaim(ImmutableRecord record, String claim) {
        DetectionResult result = claimChecker.check(claim, record);

        metricsConfig.recordClaimCheck(result.isVerified(), result.getTrustScore());
        for (Discrepancy d : result.getDiscrepancies()) {
            metricsConfig.recordDiscrepancy(d.getKind().getCode(), d.getSeverity().getValue());
        }
        return result;
    }

    private static Map<String, Object> claimContext(ImmutableRecord record, String claim) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("record_hash", record.getBindingHash());
        context.put("failed_count", record.getFacts().getFailedCount());
        context.put("claim_length", claim == null ? 0 : claim.length());
        return context;
    }

    // counters are updated even when the log append fails; keep the event instead of aborting
    private void recordDetection(String project, List<DetectionEvent> unlogged, Runnable recording) {
        try {
            recording.run();
        } catch (StorageException e) {
            DetectionEvent event = e.getPendingResult(DetectionEvent.class);
            if (event == null) {
                throw e;
            }
            unlogged.add(event);
            log.warn("Detection log for project {} not written; returning {} event with the assessment",
                    project, event.getSource());
        }
    }
}
