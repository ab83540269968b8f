package com.qa.trust.engine.checks;

import com.qa.trust.engine.ClaimCheck;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The exact failure count must be quoted.
 */
@Component
public class FailureCountCheck implements ClaimCheck {

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.MISSING_FAILURE_COUNT;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        String expected = String.valueOf(record.getFacts().getFailedCount());
        if (claim.contains(expected)) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.CRITICAL)
                .expected(expected)
                .explanation(String.format("Claim does not state the failure count: %s tests failed", expected))
                .build());
    }
}
