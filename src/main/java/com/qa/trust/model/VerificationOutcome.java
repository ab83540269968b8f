package com.qa.trust.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of re-deriving a record's binding hash. A mismatch is a reportable outcome, not an error.
 */
@Value
@Builder
public class VerificationOutcome {
    boolean valid;
    String expectedHash;
    String actualHash;
    String reason;
}
