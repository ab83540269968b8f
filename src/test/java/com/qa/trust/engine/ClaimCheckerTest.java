package com.qa.trust.engine;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.engine.record.RecordBuilder;
import com.qa.trust.model.DetectionResult;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import com.qa.trust.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClaimCheckerTest {

    private TrustConfig config;
    private ClaimChecker checker;
    private RecordBuilder recordBuilder;
    private ImmutableRecord record;

    @BeforeEach
    void setUp() {
        config = new TrustConfig();
        checker = TestDataFactory.claimChecker(config);
        recordBuilder = TestDataFactory.recordBuilder(config);
        // 50 tests, 5 failing, 90.0%
        record = recordBuilder.build(TestDataFactory.report(45, 5));
    }

    @Test
    void check_exactQuotation_verifiesWithFullTrust() {
        String claim = "5 tests are failing. Success rate is 90.0%. Deployment is BLOCKED. Hash: "
                + record.getBindingHash();

        DetectionResult result = checker.check(claim, record);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getDiscrepancies()).isEmpty();
        assertThat(result.getTrustScore()).isEqualTo(1.0);
    }

    @Test
    void check_vagueOptimisticClaim_flagsFactsAndApproval() {
        DetectionResult result = checker.check(
                "Most tests are passing, about 90% success, safe to deploy", record);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getDiscrepancies())
                .extracting(Discrepancy::getKind)
                .contains(DiscrepancyKind.MISSING_FAILURE_COUNT,
                        DiscrepancyKind.MISSING_VERIFICATION,
                        DiscrepancyKind.FALSE_DEPLOYMENT_APPROVAL,
                        DiscrepancyKind.INCORRECT_SUCCESS_RATE);
        assertThat(result.getDiscrepancies()).hasSize(4);
        assertThat(result.getTrustScore()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void check_languageChecksEnabled_discrepanciesFollowCheckOrder() {
        config.getClaims().setLanguageChecksEnabled(true);

        DetectionResult result = checker.check("Most tests are passing, about 90% success, safe to deploy", record);

        assertThat(result.getDiscrepancies()).extracting(Discrepancy::getKind).containsExactly(
                DiscrepancyKind.MISSING_FAILURE_COUNT,
                DiscrepancyKind.INCORRECT_SUCCESS_RATE,
                DiscrepancyKind.FALSE_DEPLOYMENT_APPROVAL,
                DiscrepancyKind.MISSING_VERIFICATION,
                DiscrepancyKind.APPROXIMATE_LANGUAGE,
                DiscrepancyKind.IGNORED_FAILURES);
        assertThat(result.getTrustScore()).isEqualTo(0.0);
    }

    @Test
    void check_nearlyFiftyPercent_flagsIncorrectRate() {
        ImmutableRecord third = recordBuilder.build(TestDataFactory.report(1, 2));
        String claim = "2 tests fail, nearly 50% pass. Hash " + third.getBindingHash();

        DetectionResult result = checker.check(claim, third);

        assertThat(result.getDiscrepancies())
                .filteredOn(d -> d.getKind() == DiscrepancyKind.INCORRECT_SUCCESS_RATE)
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.getExpected()).isEqualTo("33.33%");
                    assertThat(d.getSeverity()).isEqualTo(Severity.CRITICAL);
                });
    }

    @Test
    void check_approvalWithoutFailures_isNotFlagged() {
        ImmutableRecord green = recordBuilder.build(TestDataFactory.report(10, 0));
        String claim = String.join(". ", recordBuilder.requiredStatements(green)) + ". Ready to deploy.";

        DetectionResult result = checker.check(claim, green);

        assertThat(result.isVerified()).isTrue();
    }

    @Test
    void check_approvalPhraseIsCaseInsensitive() {
        String claim = "5 tests are failing. Success rate is 90.0%. We CAN DEPLOY anyway. " + record.getBindingHash();

        DetectionResult result = checker.check(claim, record);

        assertThat(result.getDiscrepancies()).extracting(Discrepancy::getKind)
                .containsExactly(DiscrepancyKind.FALSE_DEPLOYMENT_APPROVAL);
        assertThat(result.getTrustScore()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void check_missingHashOnly_isHighSeverity() {
        DetectionResult result = checker.check("5 tests are failing. Success rate is 90.0%.", record);

        assertThat(result.getDiscrepancies()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiscrepancyKind.MISSING_VERIFICATION);
            assertThat(d.getSeverity()).isEqualTo(Severity.HIGH);
        });
        assertThat(result.highestSeverity()).contains(Severity.HIGH);
    }

    @Test
    void check_requiredStatementsJoined_verify() {
        String claim = String.join(". ", recordBuilder.requiredStatements(record));

        assertThat(checker.check(claim, record).isVerified()).isTrue();
    }

    @Test
    void check_languageChecksEnabled_minimizingIsLowSeverity() {
        config.getClaims().setLanguageChecksEnabled(true);
        String claim = "Only 5 tests fail. Success rate is 90.0%. Deployment is BLOCKED. " + record.getBindingHash();

        DetectionResult result = checker.check(claim, record);

        assertThat(result.getDiscrepancies()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiscrepancyKind.MINIMIZED_FAILURES);
            assertThat(d.getSeverity()).isEqualTo(Severity.LOW);
        });
    }

    @Test
    void check_defaultSettings_hedgedWordingAroundExactFactsStillVerifies() {
        String claim = "Only 5 tests are failing; most tests pass. Success rate is 90.0%. Deployment is BLOCKED. Hash: "
                + record.getBindingHash();

        DetectionResult result = checker.check(claim, record);

        assertThat(config.getClaims().isLanguageChecksEnabled()).isFalse();
        assertThat(result.isVerified()).isTrue();
        assertThat(result.getTrustScore()).isEqualTo(1.0);
    }

    @Test
    void check_languageChecksEnabled_hedgedWordingCountsAgainstTrust() {
        config.getClaims().setLanguageChecksEnabled(true);
        String claim = "Only 5 tests are failing; most tests pass. Success rate is 90.0%. Deployment is BLOCKED. Hash: "
                + record.getBindingHash();

        DetectionResult result = checker.check(claim, record);

        assertThat(result.getDiscrepancies()).extracting(Discrepancy::getKind)
                .containsExactly(DiscrepancyKind.IGNORED_FAILURES, DiscrepancyKind.MINIMIZED_FAILURES);
        assertThat(result.getTrustScore()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void check_nullClaim_flagsEverythingLiteral() {
        DetectionResult result = checker.check(null, record);

        assertThat(result.getDiscrepancies()).extracting(Discrepancy::getKind).containsExactly(
                DiscrepancyKind.MISSING_FAILURE_COUNT,
                DiscrepancyKind.INCORRECT_SUCCESS_RATE,
                DiscrepancyKind.MISSING_VERIFICATION);
    }

    @Test
    void check_customPenalty_appliesPerDiscrepancy() {
        config.getClaims().setPenaltyPerDiscrepancy(0.1);

        DetectionResult result = checker.check("5 tests are failing. Success rate is 90.0%.", record);

        assertThat(result.getTrustScore()).isCloseTo(0.9, within(1e-9));
    }
}
