package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.SettlementOutcome;

import java.util.UUID;

/**
 * Result of a settlement trigger.
 *
 * @param roundUpConfigId Config the trigger was for
 * @param outcome         What the trigger did
 * @param donation        Donation created or found in flight, null when nothing was settled
 */
public record SettlementResponse(
        UUID roundUpConfigId,
        SettlementOutcome outcome,
        DonationResponse donation
) {
}
