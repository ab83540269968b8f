package com.qa.trust.engine;

import com.qa.trust.model.Discrepancy;
import com.qa.trust.model.DiscrepancyKind;
import com.qa.trust.model.ImmutableRecord;

import java.util.Optional;

/**
 * One check of a free-text claim against a record's facts.
 */
public interface ClaimCheck {

    /**
     * The discrepancy kind this check reports. Checks run in the kind's declaration order.
     */
    DiscrepancyKind getKind();

    /**
     * Wording heuristics rather than fact checks; these can be switched off by configuration.
     */
    default boolean isLanguageCheck() {
        return false;
    }

    /**
     * @param claim  the claim text, never null
     * @param record the record the claim describes
     * @return a discrepancy, or empty when the claim passes this check
     */
    Optional<Discrepancy> check(String claim, ImmutableRecord record);
}
