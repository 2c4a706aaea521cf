package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.RoundUpStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dashboard view of a round-up configuration.
 *
 * @param roundUpConfigId        Config UUID
 * @param status                 Settlement cycle status
 * @param currentMonthTotal      Unsettled round-ups of the current month
 * @param totalAccumulated       Lifetime round-ups
 * @param totalDonated           Sum of base amounts of completed donations
 * @param unsettledTransactions  Round-ups waiting for settlement
 * @param monthlyThreshold       Settlement threshold, null for no limit
 * @param nextCharitySwitchAt    Earliest time the destination may change again, null if now
 */
public record RoundUpSummaryResponse(
        UUID roundUpConfigId,
        RoundUpStatus status,
        BigDecimal currentMonthTotal,
        BigDecimal totalAccumulated,
        BigDecimal totalDonated,
        long unsettledTransactions,
        BigDecimal monthlyThreshold,
        LocalDateTime nextCharitySwitchAt
) {
}
