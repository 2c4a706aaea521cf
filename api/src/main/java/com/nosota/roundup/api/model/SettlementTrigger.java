package com.nosota.roundup.api.model;

/**
 * What asked for a settlement.
 */
public enum SettlementTrigger {
    THRESHOLD,
    SCHEDULED,
    MANUAL
}
