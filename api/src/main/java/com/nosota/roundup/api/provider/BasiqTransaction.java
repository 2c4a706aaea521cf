package com.nosota.roundup.api.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nosota.roundup.api.model.BankProvider;
import jakarta.validation.constraints.NotBlank;

/**
 * Basiq transaction payload ({@code /users/{userId}/transactions}).
 *
 * <p>Amounts are signed decimal strings, negative for money leaving the account.
 *
 * @param transactionId   Basiq transaction id
 * @param accountId       Basiq account id
 * @param status          posted or pending
 * @param description     Bank statement description
 * @param amount          Signed amount as a decimal string
 * @param currency        Currency code, AUD when absent
 * @param direction       debit or credit
 * @param transactionClass Basiq transaction class (payment, transfer, cash-withdrawal, bank-fee, ...)
 * @param subClass        Finer ANZSIC-based classification
 * @param postDate        Posting timestamp (ISO-8601 date or date-time)
 * @param transactionDate Transaction timestamp, may be null
 *
 * <p>Type id handling is switched off on the concrete record so raw Basiq API payloads
 * deserialize directly; the {@code provider} property is only needed through {@link ProviderTransaction}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BasiqTransaction(
        @NotBlank
        @JsonProperty("id")
        String transactionId,

        @JsonProperty("account")
        String accountId,

        @JsonProperty("status")
        String status,

        @JsonProperty("description")
        String description,

        @NotBlank
        @JsonProperty("amount")
        String amount,

        @JsonProperty("currency")
        String currency,

        @JsonProperty("direction")
        String direction,

        @JsonProperty("class")
        String transactionClass,

        @JsonProperty("subClass")
        SubClass subClass,

        @JsonProperty("postDate")
        String postDate,

        @JsonProperty("transactionDate")
        String transactionDate
) implements ProviderTransaction {

    @Override
    public BankProvider provider() {
        return BankProvider.BASIQ;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubClass(
            @JsonProperty("title") String title,
            @JsonProperty("code") String code
    ) {
    }
}
