package com.qa.trust.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Binding hash and its provenance")
public class VerificationStamp {

    public static final String CURRENT_VERSION = "1.0";
    public static final String SHA_256 = "sha256";

    @JsonProperty("version")
    @Schema(example = "1.0")
    String version;

    @JsonProperty("algorithm")
    @Schema(example = "sha256")
    String algorithm;

    @JsonProperty("hash")
    @Schema(description = "Lower-case hex SHA-256 of the canonical facts + failed_case_details")
    String hash;

    @JsonProperty("timestamp")
    @Schema(description = "ISO-8601 creation time", example = "2026-01-15T10:15:30Z")
    String timestamp;
}
