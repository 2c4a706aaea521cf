package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.BankProvider;
import lombok.Builder;

/**
 * Normalized bank connection webhook event.
 *
 * <p>Connections are matched by {@code providerConnectionId} when present, otherwise by
 * {@code providerUserRef}; account events narrow the match to {@code providerAccountId}.
 *
 * @param type                 Event type
 * @param provider             Aggregator that sent it
 * @param rawType              Provider event name, for logging
 * @param providerConnectionId Plaid item id or Basiq connection id
 * @param providerAccountId    Affected account, for account events
 * @param providerUserRef      Basiq user id, for user-level events
 * @param accountStatus        New account status, for account events
 * @param errorCode            Provider error code
 * @param errorMessage         Provider error message
 */
@Builder
public record ConnectionEvent(
        ConnectionEventType type,
        BankProvider provider,
        String rawType,
        String providerConnectionId,
        String providerAccountId,
        String providerUserRef,
        String accountStatus,
        String errorCode,
        String errorMessage
) {
}
