package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A parsed test run. The declared aggregates are whatever the producer claimed;
 * consumers derive the real counts from {@link #getCases()}.
 */
@Value
@Builder
@Schema(description = "Structured test-run report")
public class TestRunReport {

    @Schema(description = "Declared total, as supplied by the producer")
    Integer declaredTotal;

    @Schema(description = "Declared passed count")
    Integer declaredPassed;

    @Schema(description = "Declared failed count")
    Integer declaredFailed;

    @Schema(description = "Declared skipped count")
    Integer declaredSkipped;

    @Schema(description = "Total run duration in seconds")
    Double totalDuration;

    @Singular("testCase")
    @Schema(description = "Executed test cases in report order")
    List<TestCaseResult> cases;

    public int countOf(TestOutcome outcome) {
        return (int) cases.stream().filter(c -> c.getOutcome() == outcome).count();
    }

    public int failureCount() {
        return (int) cases.stream().filter(c -> c.getOutcome().isFailure()).count();
    }

    /**
     * Run duration: the declared total when present, otherwise the sum of case durations.
     */
    public double effectiveDuration() {
        if (totalDuration != null) {
            return totalDuration;
        }
        return cases.stream().mapToDouble(TestCaseResult::getDuration).sum();
    }

    /**
     * True when every declared aggregate that is present matches the count derived from the cases.
     */
    public boolean isAggregateConsistent() {
        return matches(declaredTotal, cases.size())
                && matches(declaredPassed, countOf(TestOutcome.PASSED))
                && matches(declaredFailed, failureCount())
                && matches(declaredSkipped, countOf(TestOutcome.SKIPPED));
    }

    private static boolean matches(Integer declared, int derived) {
        return declared == null || declared == derived;
    }
}
