package com.nosota.roundup.client.payment;

/**
 * Processor answer to a charge request or lookup.
 *
 * @param chargeId      Processor charge reference
 * @param status        Charge state
 * @param failureReason Processor message for failed charges
 */
public record ChargeResult(String chargeId, ChargeStatus status, String failureReason) {

    public boolean isFailed() {
        return status == ChargeStatus.FAILED;
    }
}
