package com.nosota.roundup.dto;

/**
 * Provider-neutral bank connection webhook event.
 */
public enum ConnectionEventType {
    TRANSACTIONS_UPDATED,
    CONNECTION_INVALIDATED,
    CONSENT_REVOKED,
    CONSENT_EXPIRED,
    ACCOUNT_UPDATED,
    USER_DELETED,
    LOGIN_REQUIRED,
    ERROR,
    /**
     * Known event that needs no action.
     */
    IGNORED,
    UNKNOWN
}
