package com.nosota.roundup.dto;

/**
 * Result of applying a payment confirmation.
 */
public enum ReconciliationOutcome {
    APPLIED,
    /**
     * The donation already reached a final state.
     */
    DUPLICATE,
    /**
     * Unknown event or donation.
     */
    IGNORED
}
