package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A failing case and its inferred error category")
public class FailedCaseDetail {

    @JsonProperty("name")
    @Schema(example = "tests/test_api.py::test_login")
    String name;

    @JsonProperty("error_category")
    @Schema(example = "assertion_failure")
    ErrorCategory errorCategory;
}
