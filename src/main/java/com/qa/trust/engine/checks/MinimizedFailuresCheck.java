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

/**
 * "Only 2 tests fail" states the number but plays it down.
 */
@Component
public class MinimizedFailuresCheck implements ClaimCheck {

    private static final Pattern MINIMIZING = Pattern.compile(
            "\\b(?:only|just|merely)\\b.*?\\d+.*?\\bfail", Pattern.CASE_INSENSITIVE);

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.MINIMIZED_FAILURES;
    }

    @Override
    public boolean isLanguageCheck() {
        return true;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        if (record.getFacts().getFailedCount() == 0) {
            return Optional.empty();
        }
        Matcher matcher = MINIMIZING.matcher(claim);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.LOW)
                .expected(record.getFacts().getFailedCount() + " tests are failing")
                .explanation(String.format("Claim minimizes failures: \"%s\"", matcher.group()))
                .build());
    }
}
