package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.SettlementTrigger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a donation (settlement of accumulated round-ups).
 *
 * @param id                Donation UUID
 * @param roundUpConfigId   Config that was settled
 * @param userId            Donor
 * @param organizationId    Destination organization
 * @param causeId           Destination cause
 * @param baseAmount        Sum of the settled round-ups
 * @param processorFee      Percentage plus fixed processor fee
 * @param taxAmount         Tax on the processor fee
 * @param totalFee          Processor fee plus tax
 * @param netAmount         Amount reaching the cause
 * @param totalCharged      Amount charged to the donor
 * @param coverFees         Whether the donor covered the fees
 * @param currency          Charge currency
 * @param status            Settlement status
 * @param trigger           What requested the settlement
 * @param processorChargeId Processor reference, null until the charge is accepted
 * @param transactionCount  Number of round-ups settled
 * @param failureReason     Reason of failure, if any
 * @param createdAt         Creation time
 * @param completedAt       Confirmation time
 */
public record DonationResponse(
        UUID id,
        UUID roundUpConfigId,
        Long userId,
        Long organizationId,
        Long causeId,
        BigDecimal baseAmount,
        BigDecimal processorFee,
        BigDecimal taxAmount,
        BigDecimal totalFee,
        BigDecimal netAmount,
        BigDecimal totalCharged,
        boolean coverFees,
        String currency,
        DonationStatus status,
        SettlementTrigger trigger,
        String processorChargeId,
        int transactionCount,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
}
