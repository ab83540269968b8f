package com.qa.trust.config;

import com.qa.trust.model.SignalType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "trust")
public class TrustConfig {

    private RecordOptions record = new RecordOptions();

    private Claims claims = new Claims();

    private Signals signals = new Signals();

    // Trust-score tiers for reporting. Must satisfy 0 <= suspicious < trusted <= 1.
    private Tiers tiers = new Tiers();

    private History history = new History();

    private Alerts alerts = new Alerts();

    private Storage storage = new Storage();

    private Summary summary = new Summary();

    @PostConstruct
    public void validate() {
        signals.getWeights().validate();
        tiers.validate();
        if (history.getFlakinessWindow() < 1 || history.getMaxRunsPerProject() < 1) {
            throw new IllegalStateException("trust.history window and max-runs must be positive");
        }
        if (alerts.getThreshold() < 1) {
            throw new IllegalStateException("trust.alerts.threshold must be at least 1");
        }
    }

    @Data
    public static class RecordOptions {
        // Error text is cut to this many characters before classification.
        private int errorMessageMaxLength = 500;
        // Decimal places of exact_success_rate.
        private int successRatePrecision = 2;
    }

    @Data
    public static class Claims {
        // Each discrepancy costs this share of the claim trust score.
        private double penaltyPerDiscrepancy = 0.2;
        // Opt-in hedging / ignoring / minimizing checks. When on, their hits count against
        // verified and trust_score like the four fact checks.
        private boolean languageChecksEnabled = false;
        private List<String> deploymentApprovalPhrases = List.of(
                "can deploy", "ready to deploy", "safe to deploy", "okay to deploy", "ok to deploy",
                "deployment allowed", "deployment is allowed", "deployment approved",
                "ready for deployment");
    }

    @Data
    public static class Signals {
        private Weights weights = new Weights();
        // Count signals saturate at this value: min(count / cap, 1).
        private double countNormalizationCap = 10.0;
        // A normalized signal above this value is reported as an indicator.
        private double indicatorThreshold = 0.3;
        // Executed tests faster than this are considered instant.
        private double instantDurationThresholdSeconds = 0.01;
        private List<String> honeypotMarkers = List.of(
                "honeypot", "should_fail", "expected_fail", "deliberate_fail");
    }

    @Data
    public static class Weights {
        private double mockAbuse = 0.25;
        private double skeletonCode = 0.25;
        private double honeypotViolation = 0.20;
        private double instantTests = 0.15;
        private double hallucinations = 0.10;
        private double claimFailures = 0.05;

        public Map<SignalType, Double> asMap() {
            Map<SignalType, Double> map = new EnumMap<>(SignalType.class);
            map.put(SignalType.MOCK_ABUSE, mockAbuse);
            map.put(SignalType.SKELETON_CODE, skeletonCode);
            map.put(SignalType.HONEYPOT_VIOLATION, honeypotViolation);
            map.put(SignalType.INSTANT_TESTS, instantTests);
            map.put(SignalType.HALLUCINATIONS, hallucinations);
            map.put(SignalType.CLAIM_FAILURES, claimFailures);
            return map;
        }

        public void validate() {
            double sum = 0.0;
            for (Map.Entry<SignalType, Double> e : asMap().entrySet()) {
                if (e.getValue() < 0.0 || !Double.isFinite(e.getValue())) {
                    throw new IllegalStateException("Signal weight for " + e.getKey().getCode()
                            + " must be non-negative, got " + e.getValue());
                }
                sum += e.getValue();
            }
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalStateException("Signal weights must sum to 1.0, got " + sum);
            }
        }
    }

    @Data
    public static class Tiers {
        private double trusted = 0.8;
        private double suspicious = 0.5;

        public void validate() {
            if (suspicious < 0.0 || trusted > 1.0 || suspicious >= trusted) {
                throw new IllegalStateException(String.format(
                        "Trust tiers must satisfy 0 <= suspicious < trusted <= 1 (suspicious=%s, trusted=%s)",
                        suspicious, trusted));
            }
        }
    }

    @Data
    public static class History {
        // Runs kept per project on disk; older runs are pruned on write.
        private int maxRunsPerProject = 100;
        // Runs per test considered for flakiness.
        private int flakinessWindow = 20;
        private int minRunsForFlakiness = 3;
        private int patternLength = 10;
        // Regression: mean of the latest N durations above factor x overall mean.
        private int regressionMinSamples = 5;
        private int regressionRecentSamples = 5;
        private double regressionFactor = 1.5;
        private int trendRecentRuns = 10;
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;
        // Detections since the last alert that trigger the next one.
        private int threshold = 5;
    }

    @Data
    public static class Storage {
        // History and flaky-test files.
        private String dataDir = ".test_history";
        // Append-only detection logs and hourly summaries.
        private String logDir = "logs/trust";
    }

    @Data
    public static class Summary {
        private boolean enabled = true;
        private String cron = "0 0 * * * *";
        private int topPatterns = 5;
    }
}
