package com.nosota.roundup.client.payment;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Charge of a donor's stored payment method for one donation.
 *
 * @param paymentMethodId    Stored payment method reference
 * @param amount             Total charged to the donor
 * @param currency           ISO currency code
 * @param destinationAccount Connected payout account of the organization, null to keep funds on the platform
 * @param transferAmount     Part of {@code amount} transferred to the destination
 * @param idempotencyKey     Sent to the processor so a repeated request returns the same charge
 * @param description        Statement description
 * @param metadata           Tags echoed back in confirmations; must contain {@code donationId}
 */
@Builder
public record ChargeRequest(
        String paymentMethodId,
        BigDecimal amount,
        String currency,
        String destinationAccount,
        BigDecimal transferAmount,
        String idempotencyKey,
        String description,
        Map<String, String> metadata
) {
}
