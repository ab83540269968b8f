package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Tamper-evident record of a test run")
public class ImmutableRecord {

    @JsonProperty("facts")
    FactSheet facts;

    @JsonProperty("failed_case_details")
    List<FailedCaseDetail> failedCaseDetails;

    @JsonProperty("verification")
    VerificationStamp verification;

    @JsonIgnore
    public String getBindingHash() {
        return verification == null ? null : verification.getHash();
    }

    @JsonIgnore
    public String getCreatedAt() {
        return verification == null ? null : verification.getTimestamp();
    }
}
