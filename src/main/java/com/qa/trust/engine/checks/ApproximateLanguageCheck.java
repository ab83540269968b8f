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
 * Hedged percentages ("about 90%", "95% or so, roughly") are how rounding-up hides failures.
 */
@Component
public class ApproximateLanguageCheck implements ClaimCheck {

    private static final String HEDGE = "(?:approximately|about|around|nearly|roughly|almost)";
    private static final Pattern HEDGED_RATE = Pattern.compile(
            "\\b" + HEDGE + "\\s+\\d+(?:\\.\\d+)?\\s*%|\\d+(?:\\.\\d+)?\\s*%[^.]{0,40}?\\b" + HEDGE + "\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public DiscrepancyKind getKind() {
        return DiscrepancyKind.APPROXIMATE_LANGUAGE;
    }

    @Override
    public boolean isLanguageCheck() {
        return true;
    }

    @Override
    public Optional<Discrepancy> check(String claim, ImmutableRecord record) {
        Matcher matcher = HEDGED_RATE.matcher(claim);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Discrepancy.builder()
                .kind(getKind())
                .severity(Severity.MEDIUM)
                .expected(record.getFacts().formattedSuccessRate())
                .explanation(String.format("Claim approximates the success rate: \"%s\"", matcher.group()))
                .build());
    }
}
