package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.RoundUpStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a round-up configuration.
 *
 * @param id                  Config UUID
 * @param userId              Owning user
 * @param bankConnectionId    Connection the round-ups come from
 * @param organizationId      Destination organization
 * @param causeId             Destination cause
 * @param paymentMethodId     Processor payment method reference
 * @param monthlyThreshold    Settlement threshold, null for no limit
 * @param coverFees           Whether the donor covers processing fees
 * @param currency            Settlement currency
 * @param specialMessage      Message passed on with donations
 * @param currentMonthTotal   Unsettled round-ups of the current month
 * @param totalAccumulated    Lifetime round-ups
 * @param enabled             False while paused or after cancellation
 * @param status              Settlement cycle status
 * @param lastCharitySwitch   Last destination change, null if never switched
 * @param lastDonationAttempt Last settlement attempt
 * @param lastFailureReason   Reason of the last failed settlement or cancellation
 * @param createdAt           Creation time
 */
public record RoundUpConfigResponse(
        UUID id,
        Long userId,
        UUID bankConnectionId,
        Long organizationId,
        Long causeId,
        String paymentMethodId,
        BigDecimal monthlyThreshold,
        boolean coverFees,
        String currency,
        String specialMessage,
        BigDecimal currentMonthTotal,
        BigDecimal totalAccumulated,
        boolean enabled,
        RoundUpStatus status,
        LocalDateTime lastCharitySwitch,
        LocalDateTime lastDonationAttempt,
        String lastFailureReason,
        LocalDateTime createdAt
) {
}
