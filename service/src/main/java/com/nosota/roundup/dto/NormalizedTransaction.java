package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.BankProvider;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Provider-neutral view of a bank transaction.
 *
 * @param provider              Aggregator that reported it
 * @param providerTransactionId Provider transaction id
 * @param providerAccountId     Provider account id
 * @param amount                Positive magnitude of the amount
 * @param currency              Upper-case ISO currency code
 * @param date                  Posting date, null when the provider has none yet
 * @param name                  Merchant name or statement description
 * @param categories            Upper-case category tags
 * @param direction             Debit or credit
 * @param kind                  Provider-neutral type
 * @param pending               Still pending at the provider
 */
@Builder
public record NormalizedTransaction(
        BankProvider provider,
        String providerTransactionId,
        String providerAccountId,
        BigDecimal amount,
        String currency,
        LocalDate date,
        String name,
        List<String> categories,
        TransactionDirection direction,
        TransactionKind kind,
        boolean pending
) {
}
