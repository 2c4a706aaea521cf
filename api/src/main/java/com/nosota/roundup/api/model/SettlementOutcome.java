package com.nosota.roundup.api.model;

/**
 * Result of a settlement trigger.
 */
public enum SettlementOutcome {
    /**
     * Charge accepted by the processor, donation is PROCESSING.
     */
    CHARGE_REQUESTED,

    /**
     * Charge rejected synchronously, donation is FAILED and the round-ups stay on the ledger.
     */
    CHARGE_REJECTED,

    /**
     * Charge request timed out; the donation stays PENDING until reconciliation resolves it.
     */
    OUTCOME_UNKNOWN,

    /**
     * Nothing to settle, or the amount is below the settlement minimum.
     */
    NOTHING_TO_SETTLE,

    /**
     * A settlement for this config is already in flight.
     */
    DUPLICATE
}
