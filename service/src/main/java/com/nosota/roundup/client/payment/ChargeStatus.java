package com.nosota.roundup.client.payment;

/**
 * Processor-side state of a charge, reduced to what settlement needs.
 */
public enum ChargeStatus {
    SUCCEEDED,
    /**
     * Accepted, final result arrives by webhook.
     */
    PROCESSING,
    REQUIRES_ACTION,
    FAILED
}
