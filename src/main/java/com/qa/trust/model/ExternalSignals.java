package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signals produced outside the engine (static analysis, earlier claim audits).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Pre-computed signals supplied by external analyzers")
public class ExternalSignals {

    @Schema(description = "Mock-abuse ratio from structural analysis", example = "0.3")
    private double mockAbuseRatio;

    @Schema(description = "Skeleton-code ratio from structural analysis", example = "0.1")
    private double skeletonRatio;

    @Schema(description = "Claims about this project that previously failed verification", example = "2")
    private int claimFailureCount;

    public static ExternalSignals none() {
        return new ExternalSignals();
    }
}
