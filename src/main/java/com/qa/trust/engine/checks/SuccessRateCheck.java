package com.qa.trust.engine.checks;

import com.qa.trust.engine.ClaimCheck;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SuccessRateCheck implements ClaimCheck {

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.INCORRECT_SUCCESS_RATE;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        String expected = record.getFacts().formattedSuccessRate();
        if (claim.contains(expected)) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.CRITICAL)
                .expected(expected)
                .explanation(String.format("Claim does not quote the exact success rate %s", expected))
                .build());
    }
}
