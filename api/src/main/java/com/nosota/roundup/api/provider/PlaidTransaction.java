package com.nosota.roundup.api.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nosota.roundup.api.model.BankProvider;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Plaid transaction payload ({@code /transactions/get} and {@code /transactions/sync}).
 *
 * <p>Plaid reports outflows (purchases) as positive amounts and inflows as negative ones.
 *
 * @param transactionId           Plaid transaction id
 * @param accountId               Plaid account id
 * @param amount                  Signed amount, positive for debits
 * @param isoCurrencyCode         ISO currency, null for unofficial currencies
 * @param unofficialCurrencyCode  Currency code when {@code isoCurrencyCode} is null
 * @param date                    Posting date
 * @param name                    Raw transaction name
 * @param merchantName            Cleaned merchant name, may be null
 * @param category                Legacy category hierarchy
 * @param personalFinanceCategory Current category taxonomy
 * @param pending                 Whether the transaction is still pending
 * @param transactionType         Legacy type: place, digital, special or unresolved
 * @param paymentChannel          online, in store or other
 *
 * <p>Type id handling is switched off on the concrete record so raw Plaid API payloads
 * deserialize directly; the {@code provider} property is only needed through {@link ProviderTransaction}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaidTransaction(
        @NotBlank
        @JsonProperty("transaction_id")
        String transactionId,

        @JsonProperty("account_id")
        String accountId,

        @NotNull
        @JsonProperty("amount")
        BigDecimal amount,

        @JsonProperty("iso_currency_code")
        String isoCurrencyCode,

        @JsonProperty("unofficial_currency_code")
        String unofficialCurrencyCode,

        @JsonProperty("date")
        LocalDate date,

        @JsonProperty("name")
        String name,

        @JsonProperty("merchant_name")
        String merchantName,

        @JsonProperty("category")
        List<String> category,

        @JsonProperty("personal_finance_category")
        PersonalFinanceCategory personalFinanceCategory,

        @JsonProperty("pending")
        boolean pending,

        @JsonProperty("transaction_type")
        String transactionType,

        @JsonProperty("payment_channel")
        String paymentChannel
) implements ProviderTransaction {

    @Override
    public BankProvider provider() {
        return BankProvider.PLAID;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersonalFinanceCategory(
            @JsonProperty("primary") String primary,
            @JsonProperty("detailed") String detailed
    ) {
    }
}
