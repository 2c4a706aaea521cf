package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for one accepted round-up.
 *
 * @param id                       Round-up UUID
 * @param roundUpConfigId          Config the round-up accumulated on
 * @param bankConnectionId         Connection that reported the purchase
 * @param provider                 Bank data provider
 * @param providerTransactionId    Provider's transaction id
 * @param originalAmount           Purchase amount
 * @param roundUpAmount            Amount set aside for donation
 * @param currency                 Purchase currency
 * @param transactionDate          Purchase date
 * @param transactionName          Merchant or description
 * @param categories               Provider categories
 * @param status                   Settlement status
 * @param donationId               Donation settling this round-up, if any
 * @param lastPaymentFailureReason Reason of the last failed settlement, if any
 * @param donatedAt                Time the donation was confirmed
 * @param createdAt                Acceptance time
 */
public record RoundUpTransactionResponse(
        UUID id,
        UUID roundUpConfigId,
        UUID bankConnectionId,
        BankProvider provider,
        String providerTransactionId,
        BigDecimal originalAmount,
        BigDecimal roundUpAmount,
        String currency,
        LocalDate transactionDate,
        String transactionName,
        List<String> categories,
        RoundUpTransactionStatus status,
        UUID donationId,
        String lastPaymentFailureReason,
        LocalDateTime donatedAt,
        LocalDateTime createdAt
) {
}
