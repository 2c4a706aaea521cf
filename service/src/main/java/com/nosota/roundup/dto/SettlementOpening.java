package com.nosota.roundup.dto;

import com.nosota.roundup.client.payment.ChargeRequest;
import com.nosota.roundup.model.Donation;

/**
 * Result of the first settlement phase.
 *
 * <p>Either a PENDING donation with the charge to request, or the reason no charge is needed.
 *
 * @param skipped       Result to return as is when nothing was opened
 * @param donation      The new PENDING donation
 * @param chargeRequest Charge to request for it
 */
public record SettlementOpening(SettlementResult skipped, Donation donation, ChargeRequest chargeRequest) {

    public static SettlementOpening skipped(SettlementResult result) {
        return new SettlementOpening(result, null, null);
    }

    public static SettlementOpening opened(Donation donation, ChargeRequest chargeRequest) {
        return new SettlementOpening(null, donation, chargeRequest);
    }

    public boolean isOpened() {
        return donation != null;
    }
}
