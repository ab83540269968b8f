package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Weighted deception score of one analysis pass")
public class DeceptionScore {

    @Schema(example = "payments-service")
    String project;

    @Schema(description = "Weighted sum of normalized signals, in [0,1]", example = "0.215")
    double overallDeceptionScore;

    @Schema(description = "1 - overall deception score, clamped to [0,1]", example = "0.785")
    double trustScore;

    @Schema(description = "Reporting tier derived from the trust score", example = "suspicious")
    TrustTier tier;

    @Schema(description = "Weighted contribution of each signal")
    Map<SignalType, Double> contributions;

    @Schema(description = "Signals whose normalized value exceeded the indicator threshold")
    List<SignalType> indicators;

    @Schema(description = "Computation timestamp in epoch milliseconds", example = "1739886764000")
    long computedAt;

    public boolean isDeceptionFound() {
        return !indicators.isEmpty() || tier != TrustTier.TRUSTED;
    }
}
