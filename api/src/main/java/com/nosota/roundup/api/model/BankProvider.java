package com.nosota.roundup.api.model;

/**
 * Bank data aggregator a connection was linked through.
 */
public enum BankProvider {
    /**
     * PLAID: item-based aggregator, positive amounts are outflows.
     */
    PLAID,

    /**
     * BASIQ: user/connection based aggregator, signed string amounts.
     */
    BASIQ
}
