package com.nosota.roundup.api.model;

/**
 * Why an incoming provider transaction did not produce a round-up.
 */
public enum SkipReason {
    PENDING,
    CREDIT,
    EXCLUDED_CATEGORY,
    INELIGIBLE_TYPE,
    UNSUPPORTED_CURRENCY,
    ZERO_ROUND_UP,
    DUPLICATE,
    /**
     * Transaction belongs to another account of the same bank login.
     */
    ACCOUNT_MISMATCH,
    /**
     * Payload could not be parsed (bad amount or date).
     */
    MALFORMED
}
