package com.qa.trust.engine.checks;

import com.qa.trust.engine.ClaimCheck;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class VerificationHashCheck implements ClaimCheck {

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.MISSING_VERIFICATION;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        String hash = record.getBindingHash();
        if (hash != null && claim.contains(hash)) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.HIGH)
                .expected(hash)
                .explanation("Claim does not include the record's verification hash")
                .build());
    }
}
