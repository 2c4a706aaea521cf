package com.nosota.roundup.api.model;

/**
 * Status of a single accepted round-up transaction.
 */
public enum RoundUpTransactionStatus {
    /**
     * PROCESSED: accumulated on the config and waiting for settlement.
     */
    PROCESSED,

    /**
     * PROCESSING: part of a settlement whose charge was accepted.
     */
    PROCESSING,

    /**
     * DONATED: the settlement was confirmed. Immutable.
     */
    DONATED,

    /**
     * FAILED: the settlement failed after the owning config was cancelled,
     * so the round-up can no longer be retried.
     */
    FAILED
}
