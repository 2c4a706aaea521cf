package com.nosota.roundup.api.response;

import com.nosota.roundup.api.model.SkipReason;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of ingesting a batch of provider transactions.
 *
 * @param bankConnectionId     Connection the batch belonged to
 * @param received             Number of payloads in the batch
 * @param accepted             Round-up records created
 * @param roundUpTotal         Sum of round-ups accepted from this batch
 * @param skipped              Skipped payloads per reason, duplicates included
 * @param settlementsTriggered Settlements requested because the threshold was reached
 */
public record IngestionResponse(
        UUID bankConnectionId,
        int received,
        int accepted,
        BigDecimal roundUpTotal,
        Map<SkipReason, Integer> skipped,
        int settlementsTriggered
) {
}
