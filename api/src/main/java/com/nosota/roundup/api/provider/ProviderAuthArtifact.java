package com.nosota.roundup.api.provider;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nosota.roundup.api.model.BankProvider;

/**
 * What the client-side link flow hands back after the user granted access.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "provider")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlaidAuthArtifact.class, name = "plaid"),
        @JsonSubTypes.Type(value = BasiqAuthArtifact.class, name = "basiq")
})
public sealed interface ProviderAuthArtifact permits PlaidAuthArtifact, BasiqAuthArtifact {

    /**
     * Provider account the user selected for round-ups.
     */
    String accountId();

    BankProvider provider();
}
