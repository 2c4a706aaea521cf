package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.SkipReason;

/**
 * Outcome of the eligibility rules for one transaction.
 *
 * @param eligible Whether the transaction may produce a round-up
 * @param reason   First rule that rejected it, null when eligible
 */
public record EligibilityDecision(boolean eligible, SkipReason reason) {

    private static final EligibilityDecision ELIGIBLE = new EligibilityDecision(true, null);

    public static EligibilityDecision allow() {
        return ELIGIBLE;
    }

    public static EligibilityDecision rejected(SkipReason reason) {
        return new EligibilityDecision(false, reason);
    }
}
