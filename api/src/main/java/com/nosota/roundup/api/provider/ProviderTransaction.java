package com.nosota.roundup.api.provider;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nosota.roundup.api.model.BankProvider;

/**
 * Transaction as reported by a bank data aggregator, before normalization.
 *
 * <p>The {@code provider} property of the JSON payload selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "provider")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlaidTransaction.class, name = "plaid"),
        @JsonSubTypes.Type(value = BasiqTransaction.class, name = "basiq")
})
public sealed interface ProviderTransaction permits PlaidTransaction, BasiqTransaction {

    /**
     * Provider-assigned transaction id, globally unique per provider.
     */
    String transactionId();

    /**
     * Provider account the transaction was posted to.
     */
    String accountId();

    BankProvider provider();
}
