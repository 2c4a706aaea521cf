package com.nosota.roundup.dto;

/**
 * Money movement from the account holder's point of view.
 */
public enum TransactionDirection {
    DEBIT,
    CREDIT
}
