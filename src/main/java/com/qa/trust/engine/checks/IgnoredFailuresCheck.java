package com.qa.trust.engine.checks;

import com.qa.trust.engine.ClaimCheck;
import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;
import com.qa.trust.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class IgnoredFailuresCheck implements ClaimCheck {

    private static final Pattern BLANKET_PASS = Pattern.compile(
            "\\b(?:all|most|majority)\\b.*?\\btests?\\b.*?\\bpass", Pattern.CASE_INSENSITIVE);

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.IGNORED_FAILURES;
    }

    @Override
    public boolean isLanguageCheck() {
        return true;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        int failed = record.getFacts().getFailedCount();
        if (failed == 0) {
            return Optional.empty();
        }
        Matcher matcher = BLANKET_PASS.matcher(claim);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.MEDIUM)
                .expected(failed + " tests are failing")
                .explanation(String.format("Claim glosses over %d failures: \"%s\"", failed, matcher.group()))
                .build());
    }
}
