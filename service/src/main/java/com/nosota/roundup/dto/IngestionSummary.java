package com.nosota.roundup.dto;

import com.nosota.roundup.api.model.SkipReason;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Running tally of an ingestion batch.
 */
public class IngestionSummary {

    private final UUID bankConnectionId;
    private final int received;
    private int accepted;
    private BigDecimal roundUpTotal = BigDecimal.ZERO;
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    private int settlementsTriggered;

    public IngestionSummary(UUID bankConnectionId, int received) {
        this.bankConnectionId = bankConnectionId;
        this.received = received;
    }

    public void recordAccepted(BigDecimal roundUp) {
        accepted++;
        roundUpTotal = roundUpTotal.add(roundUp);
    }

    public void recordSkipped(SkipReason reason) {
        skipped.merge(reason, 1, Integer::sum);
    }

    public void recordSettlementTriggered() {
        settlementsTriggered++;
    }

    public UUID getBankConnectionId() {
        return bankConnectionId;
    }

    public int getReceived() {
        return received;
    }

    public int getAccepted() {
        return accepted;
    }

    public BigDecimal getRoundUpTotal() {
        return roundUpTotal;
    }

    public Map<SkipReason, Integer> getSkipped() {
        return skipped;
    }

    public int getSkipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    public int getSettlementsTriggered() {
        return settlementsTriggered;
    }
}
