package com.qa.trust.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
@Schema(description = "Outcome of checking a free-text claim against a record")
public class DetectionResult {

    @Schema(description = "True when no discrepancy was found")
    boolean verified;

    @Singular
    @Schema(description = "Discrepancies in check order")
    List<Discrepancy> discrepancies;

    @Schema(description = "max(0, 1 - penalty x discrepancy count)", example = "0.4")
    double trustScore;

    public int discrepancyCount() {
        return discrepancies.size();
    }

    public Optional<Severity> highestSeverity() {
        return discrepancies.stream()
                .map(Discrepancy::getSeverity)
                .min(Enum::compareTo);
    }
}
