package com.nosota.roundup.api.request;

import com.nosota.roundup.api.provider.ProviderTransaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO carrying a batch of provider transactions for one connection.
 *
 * @param transactions Provider payloads, in the order they should be accumulated
 */
public record IngestTransactionsRequest(
        @NotNull(message = "Transactions are required")
        List<@Valid ProviderTransaction> transactions
) {
}
