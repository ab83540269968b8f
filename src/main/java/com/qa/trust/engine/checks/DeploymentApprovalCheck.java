package com.qa.trust.engine.checks;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.engine.ClaimCheck;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Any approval phrase is a false claim while a single test is failing.
 */
@Component
public class DeploymentApprovalCheck implements ClaimCheck {

    private final TrustConfig config;

    public DeploymentApprovalCheck(TrustConfig config) {
        this.config = config;
    }

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.FALSE_DEPLOYMENT_APPROVAL;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        int failed = record.getFacts().getFailedCount();
        if (failed == 0) {
            return Optional.empty();
        }

        String lower = claim.toLowerCase(Locale.ROOT);
        return config.getClaims().getDeploymentApprovalPhrases().stream()
                .filter(phrase -> lower.contains(phrase.toLowerCase(Locale.ROOT)))
                .findFirst()
                .map(phrase -> Discrepancy.builder()
                        .kind(getKind())
                        .severity(Severity.CRITICAL)
                        .expected("Deployment is BLOCKED")
                        .explanation(String.format(
                                "Claim approves deployment (\"%s\") although %d tests failed", phrase, failed))
                        .build());
    }
}
