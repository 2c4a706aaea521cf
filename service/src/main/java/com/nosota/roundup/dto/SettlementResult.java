package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.model.Donation;

import java.util.UUID;

/**
 * Outcome of a settlement trigger.
 *
 * @param roundUpConfigId Config the trigger was for
 * @param outcome         What happened
 * @param donation        Donation created, or the one already in flight; null otherwise
 */
public record SettlementResult(UUID roundUpConfigId, SettlementOutcome outcome, Donation donation) {

    public static SettlementResult nothingToSettle(UUID configId) {
        return new SettlementResult(configId, SettlementOutcome.NOTHING_TO_SETTLE, null);
    }

    public boolean donationCreated() {
        return outcome == SettlementOutcome.CHARGE_REQUESTED
                || outcome == SettlementOutcome.CHARGE_REJECTED
                || outcome == SettlementOutcome.OUTCOME_UNKNOWN;
    }
}
