package com.nosota.roundup.dto;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Fee and tax split of a settlement.
 *
 * <p>Internal DTO used by the settlement service; persisted on the {@code Donation}.
 *
 * @param baseAmount   Sum of the settled round-ups
 * @param processorFee Percentage plus fixed processor fee
 * @param taxAmount    Tax on the processor fee
 * @param totalFee     processorFee + taxAmount
 * @param netAmount    Amount reaching the cause
 * @param totalCharged Amount charged to the donor
 * @param coverFees    Whether the donor pays the fees on top
 */
@Builder
public record FeeBreakdown(
        BigDecimal baseAmount,
        BigDecimal processorFee,
        BigDecimal taxAmount,
        BigDecimal totalFee,
        BigDecimal netAmount,
        BigDecimal totalCharged,
        boolean coverFees
) {
}
