package com.nosota.roundup.dto;

public enum PaymentEventType {
    CHARGE_SUCCEEDED,
    CHARGE_FAILED,
    UNKNOWN
}
