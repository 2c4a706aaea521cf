package com.nosota.roundup.api.model;

/**
 * Donation (settlement record) status.
 */
public enum DonationStatus {
    /**
     * PENDING: created, the charge request has not been answered yet.
     */
    PENDING,

    /**
     * PROCESSING: the processor accepted the charge, confirmation outstanding.
     */
    PROCESSING,

    /**
     * COMPLETED: the charge settled. Final state.
     */
    COMPLETED,

    /**
     * FAILED: the charge was rejected or failed after acceptance. Final state.
     */
    FAILED
}
