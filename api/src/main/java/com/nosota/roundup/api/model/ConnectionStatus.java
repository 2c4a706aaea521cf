package com.nosota.roundup.api.model;

/**
 * Consent lifecycle of a bank connection.
 *
 * <p>There is no way back to ACTIVE: recovery always goes through a fresh
 * consent flow which creates a new connection record.
 */
public enum ConnectionStatus {
    /**
     * ACTIVE: consent granted, ingestion and settlement are permitted.
     */
    ACTIVE,

    /**
     * ERROR: the provider reported a login-required or item error.
     * The provider error code is kept on the connection.
     */
    ERROR,

    /**
     * REVOKED: the user or the provider withdrew the consent. Final state.
     */
    REVOKED,

    /**
     * EXPIRED: the consent ran out. Final state.
     */
    EXPIRED
}
