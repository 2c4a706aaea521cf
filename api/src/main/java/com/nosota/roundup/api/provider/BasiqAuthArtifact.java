package com.nosota.roundup.api.provider;

import com.nosota.roundup.api.model.BankProvider;
import jakarta.validation.constraints.NotBlank;

/**
 * Basiq consent UI result.
 *
 * @param userId       Basiq user id the consent was granted for
 * @param connectionId Basiq connection id
 * @param accountId    Selected Basiq account id
 */
public record BasiqAuthArtifact(
        @NotBlank(message = "Basiq user ID is required")
        String userId,

        @NotBlank(message = "Connection ID is required")
        String connectionId,

        @NotBlank(message = "Account ID is required")
        String accountId
) implements ProviderAuthArtifact {

    @Override
    public BankProvider provider() {
        return BankProvider.BASIQ;
    }
}
