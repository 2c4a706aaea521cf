package com.nosota.roundup.api.model;

/**
 * Status of a round-up configuration, reflecting its settlement cycle.
 */
public enum RoundUpStatus {
    /**
     * PENDING: accumulating round-ups, no settlement in flight.
     */
    PENDING,

    /**
     * PROCESSING: a charge was accepted by the processor and awaits confirmation.
     */
    PROCESSING,

    /**
     * COMPLETED: the last settlement was confirmed.
     */
    COMPLETED,

    /**
     * FAILED: the last settlement attempt failed; accumulated round-ups are retried next cycle.
     */
    FAILED,

    /**
     * CANCELLED: consent revoked or the account went away. Final and immutable.
     */
    CANCELLED
}
