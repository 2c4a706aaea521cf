package com.nosota.roundup.dto;

/**
 * Provider-neutral transaction type.
 */
public enum TransactionKind {
    /**
     * Card or online purchase at a merchant.
     */
    PURCHASE,
    /**
     * Debit the provider did not classify further.
     */
    DEBIT,
    TRANSFER,
    CASH_WITHDRAWAL,
    FEE,
    INTEREST,
    OTHER
}
