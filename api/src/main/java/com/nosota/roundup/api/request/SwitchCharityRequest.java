package com.nosota.roundup.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for changing the donation destination.
 *
 * @param organizationId New destination organization
 * @param causeId        New destination cause
 */
public record SwitchCharityRequest(
        @NotNull(message = "Organization ID is required")
        Long organizationId,

        @NotNull(message = "Cause ID is required")
        Long causeId
) {
}
