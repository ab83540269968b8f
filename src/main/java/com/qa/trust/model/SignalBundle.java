package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * One project's signals for one analysis pass. Construction rejects out-of-range values.
 */
@Value
@Schema(description = "Heuristic deception signals for one analysis pass")
public class SignalBundle {

    @Schema(description = "Share of tests dominated by mocks", example = "0.1")
    double mockAbuseRatio;

    @Schema(description = "Share of implementation that is placeholder code", example = "0.0")
    double skeletonRatio;

    @Schema(description = "Share of honeypot tests that passed", example = "0.0")
    double honeypotViolationRatio;

    @Schema(description = "Share of executed tests that finished implausibly fast", example = "0.2")
    double instantTestRatio;

    @Schema(description = "Claim discrepancies detected in this pass", example = "3")
    int hallucinationCount;

    @Schema(description = "Claims that failed verification", example = "1")
    int claimFailureCount;

    @Builder(toBuilder = true)
    public SignalBundle(double mockAbuseRatio, double skeletonRatio, double honeypotViolationRatio,
                        double instantTestRatio, int hallucinationCount, int claimFailureCount) {
        this.mockAbuseRatio = requireRatio("mockAbuseRatio", mockAbuseRatio);
        this.skeletonRatio = requireRatio("skeletonRatio", skeletonRatio);
        this.honeypotViolationRatio = requireRatio("honeypotViolationRatio", honeypotViolationRatio);
        this.instantTestRatio = requireRatio("instantTestRatio", instantTestRatio);
        this.hallucinationCount = requireCount("hallucinationCount", hallucinationCount);
        this.claimFailureCount = requireCount("claimFailureCount", claimFailureCount);
    }

    public static SignalBundle empty() {
        return SignalBundle.builder().build();
    }

    /**
     * Raw value of a signal: the ratio itself, or the count as a double.
     */
    public double valueOf(SignalType type) {
        switch (type) {
            case MOCK_ABUSE:
                return mockAbuseRatio;
            case SKELETON_CODE:
                return skeletonRatio;
            case HONEYPOT_VIOLATION:
                return honeypotViolationRatio;
            case INSTANT_TESTS:
                return instantTestRatio;
            case HALLUCINATIONS:
                return hallucinationCount;
            case CLAIM_FAILURES:
                return claimFailureCount;
            default:
                throw new IllegalArgumentException("Unsupported signal: " + type);
        }
    }

    private static double requireRatio(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1], got " + value);
        }
        return value;
    }

    private static int requireCount(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got " + value);
        }
        return value;
    }
}
