package com.nosota.roundup.api.request;

import com.nosota.roundup.api.provider.ProviderAuthArtifact;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for linking a bank account after the user finished the provider consent flow.
 *
 * @param userId   Owning user
 * @param artifact Provider-specific result of the consent flow
 */
public record LinkBankAccountRequest(
        @NotNull(message = "User ID is required")
        Long userId,

        @NotNull(message = "Provider auth artifact is required")
        @Valid
        ProviderAuthArtifact artifact
) {
}
