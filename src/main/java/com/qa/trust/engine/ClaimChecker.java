package com.qa.trust.engine;

import com.qa.trust.config.TrustConfig;
import com.qa.trust.model.DetectionResult;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the claim-check battery against a record. Each registered {@link ClaimCheck}
 * contributes at most one discrepancy; the check is strictly literal so paraphrases
 * that drop the exact numbers are flagged.
 */
@Component
public class ClaimChecker {

    private static final Logger log = LoggerFactory.getLogger(ClaimChecker.class);

    private final Map<DiscrepancyKind, ClaimCheck> checks;
    private final TrustConfig config;

    public ClaimChecker(List<ClaimCheck> claimChecks, TrustConfig config) {
        this.checks = new EnumMap<>(DiscrepancyKind.class);
        this.config = config;

        for (ClaimCheck check : claimChecks) {
            checks.put(check.getKind(), check);
            log.info("Registered claim check: {} -> {}", check.getKind().getCode(), check.getClass().getSimpleName());
        }
    }

    public DetectionResult check(String claim, ImmutableRecord record) {
        String text = claim == null ? "" : claim;
        boolean languageChecks = config.getClaims().isLanguageChecksEnabled();

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (ClaimCheck check : checks.values()) {
            if (check.isLanguageCheck() && !languageChecks) {
                continue;
            }
            Optional<Discrepancy> found = check.check(text, record);
            found.ifPresent(discrepancies::add);
        }

        double penalty = config.getClaims().getPenaltyPerDiscrepancy();
        double trustScore = Math.max(0.0, 1.0 - penalty * discrepancies.size());

        if (!discrepancies.isEmpty()) {
            log.debug("Claim has {} discrepancies against record {}: {}",
                    discrepancies.size(), record.getBindingHash(),
                    discrepancies.stream().map(d -> d.getKind().getCode()).toList());
        }

        return DetectionResult.builder()
                .verified(discrepancies.isEmpty())
                .discrepancies(discrepancies)
                .trustScore(Math.round(trustScore * 10000.0) / 10000.0)
                .build();
    }
}
