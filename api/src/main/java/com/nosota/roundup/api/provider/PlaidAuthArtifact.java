package com.nosota.roundup.api.provider;

import com.nosota.roundup.api.model.BankProvider;
import jakarta.validation.constraints.NotBlank;

/**
 * Plaid Link result.
 *
 * @param publicToken Short-lived public token, exchanged server-side for an access token
 * @param accountId   Selected Plaid account id
 */
public record PlaidAuthArtifact(
        @NotBlank(message = "Public token is required")
        String publicToken,

        @NotBlank(message = "Account ID is required")
        String accountId
) implements ProviderAuthArtifact {

    @Override
    public BankProvider provider() {
        return BankProvider.PLAID;
    }
}
