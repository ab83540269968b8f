package com.qa.trust.engine.record;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.ErrorCategory;
import com.qa.trust.model.FactSheet;
import com.qa.trust.model.FailedCaseDetail;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.TestCaseResult;
import com.qa.trust.model.TestOutcome;
import com.qa.trust.model.TestRunReport;
import com.qa.trust.model.VerificationStamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Freezes a test run into an {@link ImmutableRecord}.
 * <p>
 * Counts are always recomputed from the case list; declared aggregates are only compared
 * against them for logging. The binding hash covers facts and failed case details.
 */
@Component
public class RecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(RecordBuilder.class);

    private final ReportParser reportParser;
    private final CanonicalSerializer canonicalSerializer;
    private final TrustConfig config;
    private final Clock clock;

    public RecordBuilder(ReportParser reportParser, CanonicalSerializer canonicalSerializer,
                         TrustConfig config, Clock clock) {
        this.reportParser = reportParser;
        this.canonicalSerializer = canonicalSerializer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Parse and freeze a raw JSON report.
     *
     * @throws com.qa.trust.exception.MalformedReportException if the report has malformed cases
     */
    public ImmutableRecord build(String reportJson) {
        return build(reportParser.parse(reportJson));
    }

    public ImmutableRecord build(TestRunReport report) {
        if (!report.isAggregateConsistent()) {
            log.warn("Declared aggregates disagree with case list (declared total={}, passed={}, failed={}, skipped={}; "
                            + "derived total={}, passed={}, failed={}, skipped={}). Using derived counts.",
                    report.getDeclaredTotal(), report.getDeclaredPassed(), report.getDeclaredFailed(),
                    report.getDeclaredSkipped(), report.getCases().size(), report.countOf(TestOutcome.PASSED),
                    report.failureCount(), report.countOf(TestOutcome.SKIPPED));
        }

        FactSheet facts = deriveFacts(report);
        List<FailedCaseDetail> failedDetails = deriveFailedCaseDetails(report);
        String hash = canonicalSerializer.hash(facts, failedDetails);

        return ImmutableRecord.builder()
                .facts(facts)
                .failedCaseDetails(List.copyOf(failedDetails))
                .verification(VerificationStamp.builder()
                        .version(VerificationStamp.CURRENT_VERSION)
                        .algorithm(VerificationStamp.SHA_256)
                        .hash(hash)
                        .timestamp(DateTimeFormatter.ISO_INSTANT.format(clock.instant()))
                        .build())
                .build();
    }

    public FactSheet deriveFacts(TestRunReport report) {
        int total = report.getCases().size();
        int passed = report.countOf(TestOutcome.PASSED);
        int failed = report.failureCount();
        int skipped = report.countOf(TestOutcome.SKIPPED);

        return FactSheet.builder()
                .totalTestCount(total)
                .passedCount(passed)
                .failedCount(failed)
                .skippedCount(skipped)
                .exactSuccessRate(exactSuccessRate(passed, total))
                .deploymentAllowed(failed == 0)
                .build();
    }

    public BigDecimal exactSuccessRate(int passed, int total) {
        if (total == 0) {
            return CanonicalSerializer.normalizeRate(BigDecimal.ZERO);
        }
        BigDecimal rate = BigDecimal.valueOf(passed)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), config.getRecord().getSuccessRatePrecision(), RoundingMode.HALF_UP);
        return CanonicalSerializer.normalizeRate(rate);
    }

    private List<FailedCaseDetail> deriveFailedCaseDetails(TestRunReport report) {
        List<FailedCaseDetail> details = new ArrayList<>();
        for (TestCaseResult testCase : report.getCases()) {
            if (!testCase.getOutcome().isFailure()) {
                continue;
            }
            ErrorCategory category = testCase.getError() == null
                    ? ErrorCategory.UNKNOWN
                    : testCase.getError().getCategory();
            details.add(FailedCaseDetail.builder()
                    .name(testCase.getId())
                    .errorCategory(category)
                    .build());
        }
        return details;
    }

    /**
     * Sentences a faithful summary of the record must contain verbatim. Joined together they
     * pass every claim check.
     */
    public List<String> requiredStatements(ImmutableRecord record) {
        FactSheet facts = record.getFacts();
        return List.of(
                facts.getFailedCount() + " tests are failing",
                "Success rate is " + facts.formattedSuccessRate(),
                "Deployment is " + (facts.isDeploymentAllowed() ? "ALLOWED" : "BLOCKED"),
                "Verification hash: " + record.getBindingHash());
    }
}
