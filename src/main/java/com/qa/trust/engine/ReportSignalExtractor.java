package com.qa.trust.engine;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.DetectionResult;
import com.qa.trust.model.ExternalSignals;
import com.qa.trust.model.SignalBundle;
import com.qa.trust.model.TestCaseResult;
import com.qa.trust.model.TestOutcome;
import com.qa.trust.model.TestRunReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Derives the report-observable signals (instant tests, honeypot violations, claim
 * discrepancies) and merges them with externally computed structural signals.
 */
@Component
public class ReportSignalExtractor {

    private final TrustConfig config;

    public ReportSignalExtractor(TrustConfig config) {
        this.config = config;
    }

    public SignalBundle extract(TestRunReport report, ExternalSignals external, DetectionResult claimDetection) {
        ExternalSignals ext = external == null ? ExternalSignals.none() : external;

        int hallucinations = claimDetection == null ? 0 : claimDetection.discrepancyCount();
        int claimFailures = ext.getClaimFailureCount()
                + (claimDetection != null && !claimDetection.isVerified() ? 1 : 0);

        return SignalBundle.builder()
                .mockAbuseRatio(ext.getMockAbuseRatio())
                .skeletonRatio(ext.getSkeletonRatio())
                .honeypotViolationRatio(honeypotViolationRatio(report))
                .instantTestRatio(instantTestRatio(report))
                .hallucinationCount(hallucinations)
                .claimFailureCount(claimFailures)
                .build();
    }

    /**
     * Share of executed (non-skipped) tests faster than the instant threshold.
     */
    public double instantTestRatio(TestRunReport report) {
        double threshold = config.getSignals().getInstantDurationThresholdSeconds();
        List<TestCaseResult> executed = report.getCases().stream()
                .filter(c -> c.getOutcome() != TestOutcome.SKIPPED)
                .toList();
        if (executed.isEmpty()) {
            return 0.0;
        }
        long instant = executed.stream().filter(c -> c.getDuration() < threshold).count();
        return (double) instant / executed.size();
    }

    /**
     * Honeypots are designed to fail; each one that passed is a violation.
     */
    public double honeypotViolationRatio(TestRunReport report) {
        List<TestCaseResult> honeypots = report.getCases().stream()
                .filter(c -> isHoneypot(c.getId()))
                .toList();
        if (honeypots.isEmpty()) {
            return 0.0;
        }
        long violations = honeypots.stream().filter(c -> c.getOutcome() == TestOutcome.PASSED).count();
        return (double) violations / honeypots.size();
    }

    public boolean isHoneypot(String testId) {
        String lower = testId.toLowerCase(Locale.ROOT);
        return config.getSignals().getHoneypotMarkers().stream()
                .anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
    }
}
