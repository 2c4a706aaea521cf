package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.SkipReason;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of offering one round-up to the ledger.
 *
 * @param accepted          Whether a round-up record was created
 * @param skipReason        Why not, when not accepted
 * @param roundUpConfigId   Config the round-up was accumulated on
 * @param roundUpAmount     Accumulated amount
 * @param currentMonthTotal Config total after accumulation
 * @param thresholdReached  The monthly threshold is reached and a settlement is due
 */
public record LedgerEntryResult(
        boolean accepted,
        SkipReason skipReason,
        UUID roundUpConfigId,
        BigDecimal roundUpAmount,
        BigDecimal currentMonthTotal,
        boolean thresholdReached
) {

    public static LedgerEntryResult accepted(UUID configId, BigDecimal roundUp, BigDecimal total, boolean thresholdReached) {
        return new LedgerEntryResult(true, null, configId, roundUp, total, thresholdReached);
    }

    public static LedgerEntryResult skipped(UUID configId, SkipReason reason) {
        return new LedgerEntryResult(false, reason, configId, BigDecimal.ZERO, null, false);
    }
}
