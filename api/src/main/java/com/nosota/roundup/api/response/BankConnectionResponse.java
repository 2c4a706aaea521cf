package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.ConnectionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a linked bank connection.
 *
 * @param id                   Connection UUID
 * @param userId               Owning user
 * @param provider             Aggregator the connection was linked through
 * @param providerConnectionId Plaid item id or Basiq connection id
 * @param providerAccountId    Linked account at the provider
 * @param institutionName      Bank name, when the provider reports one
 * @param accountName          Account display name
 * @param status               Consent state
 * @param active               Whether ingestion is permitted
 * @param errorCode            Last provider error code, if any
 * @param errorMessage         Human-readable reason for the last non-active transition
 * @param lastSyncedAt         Last successful sync
 * @param createdAt            Link time
 */
public record BankConnectionResponse(
        UUID id,
        Long userId,
        BankProvider provider,
        String providerConnectionId,
        String providerAccountId,
        String institutionName,
        String accountName,
        ConnectionStatus status,
        boolean active,
        String errorCode,
        String errorMessage,
        LocalDateTime lastSyncedAt,
        LocalDateTime createdAt
) {
}
