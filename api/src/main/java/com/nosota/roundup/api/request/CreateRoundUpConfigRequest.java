package com.nosota.roundup.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for setting up round-ups on a linked bank connection.
 *
 * @param userId           Owning user
 * @param bankConnectionId Connection the round-ups are taken from
 * @param organizationId   Destination organization
 * @param causeId          Destination cause, must belong to the organization
 * @param monthlyThreshold Monthly amount that forces a settlement, null for no limit
 * @param paymentMethodId  Processor payment method reference charged on settlement
 * @param coverFees        Whether the donor pays processing fees on top of the round-ups
 * @param specialMessage   Optional message passed on with each donation
 */
public record CreateRoundUpConfigRequest(
        @NotNull(message = "User ID is required")
        Long userId,

        @NotNull(message = "Bank connection ID is required")
        UUID bankConnectionId,

        @NotNull(message = "Organization ID is required")
        Long organizationId,

        @NotNull(message = "Cause ID is required")
        Long causeId,

        @Positive(message = "Monthly threshold must be positive")
        BigDecimal monthlyThreshold,

        @NotBlank(message = "Payment method ID is required")
        String paymentMethodId,

        boolean coverFees,

        @Size(max = 250, message = "Special message must be at most 250 characters")
        String specialMessage
) {
}
