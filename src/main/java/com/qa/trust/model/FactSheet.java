package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Frozen facts of a test run, derived from the case list")
public class FactSheet {

    @JsonProperty("total_test_count")
    @Schema(description = "Number of test cases in the run", example = "50")
    int totalTestCount;

    @JsonProperty("passed_count")
    @Schema(example = "45")
    int passedCount;

    @JsonProperty("failed_count")
    @Schema(description = "Failed plus errored cases", example = "5")
    int failedCount;

    @JsonProperty("skipped_count")
    @Schema(example = "0")
    int skippedCount;

    @JsonProperty("exact_success_rate")
    @Schema(description = "passed / total * 100, rounded half-up to the configured precision", example = "90.0")
    BigDecimal exactSuccessRate;

    @JsonProperty("deployment_allowed")
    @Schema(description = "True only when failed_count is zero", example = "false")
    boolean deploymentAllowed;

    /**
     * The rate exactly as a faithful claim must quote it, e.g. {@code 90.0%}.
     */
    public String formattedSuccessRate() {
        return exactSuccessRate.toPlainString() + "%";
    }
}
