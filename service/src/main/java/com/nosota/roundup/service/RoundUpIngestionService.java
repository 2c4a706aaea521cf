package com.nosota.roundup.service;

import com.nosota.roundup.api.model.SettlementTrigger;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.dto.EligibilityDecision;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.dto.LedgerEntryResult;
import com.nosota.roundup.dto.NormalizedTransaction;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.RoundUpTransactionRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Ingestion pipeline: dedup → normalize → filter → round-up → ledger.
 *
 * <p>Idempotent per provider transaction id: a re-delivered transaction is counted as
 * {@link SkipReason#DUPLICATE} and changes nothing. The storage-level unique constraint
 * closes the race between two concurrent deliveries.
 *
 * <p>When a round-up brings the config to its monthly threshold, settlement is triggered right away and
 * the rest of the batch keeps accumulating for the next cycle.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RoundUpIngestionService {

    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpTransactionRepository roundUpTransactionRepository;
    private final TransactionNormalizer normalizer;
    private final EligibilityFilter eligibilityFilter;
    private final RoundUpCalculator calculator;
    private final RoundUpLedgerService ledgerService;
    private final SettlementService settlementService;

    /**
     * Ingests provider transactions reported for one connection.
     *
     * @param connectionId Connection the transactions belong to
     * @param transactions Provider payloads
     * @return Per-batch tally
     * @throws NotFoundException     if the connection or its active config does not exist
     * @throws InvalidStateException if the connection is not ACTIVE or round-ups are paused or cancelled
     */
    public IngestionSummary ingestProviderTransactions(@NotNull UUID connectionId,
                                                       @NotNull List<ProviderTransaction> transactions)
            throws NotFoundException, InvalidStateException {
        BankConnection connection = bankConnectionRepository.findById(connectionId)
                .orElseThrow(() -> new NotFoundException("Bank connection not found: " + connectionId));
        RoundUpLedgerService.requireActive(connection);

        IngestionSummary summary = new IngestionSummary(connectionId, transactions.size());
        for (ProviderTransaction transaction : transactions) {
            ingestOne(connection, transaction, summary);
        }

        log.info("Ingested batch for connection {}: received={}, accepted={}, roundUpTotal={}, skipped={}, settlements={}",
                connectionId, summary.getReceived(), summary.getAccepted(), summary.getRoundUpTotal(),
                summary.getSkipped(), summary.getSettlementsTriggered());
        return summary;
    }

    // ==================== Private Helper Methods ====================

    private void ingestOne(BankConnection connection, ProviderTransaction transaction, IngestionSummary summary)
            throws NotFoundException, InvalidStateException {
        if (transaction == null || transaction.transactionId() == null || transaction.transactionId().isBlank()) {
            summary.recordSkipped(SkipReason.MALFORMED);
            return;
        }
        if (roundUpTransactionRepository.existsByProviderTransactionId(transaction.transactionId())) {
            log.debug("Provider transaction {} already ingested", transaction.transactionId());
            summary.recordSkipped(SkipReason.DUPLICATE);
            return;
        }
        if (transaction.provider() != connection.getProvider()
                || (transaction.accountId() != null && !transaction.accountId().equals(connection.getProviderAccountId()))) {
            summary.recordSkipped(SkipReason.ACCOUNT_MISMATCH);
            return;
        }

        NormalizedTransaction normalized;
        try {
            normalized = normalizer.normalize(transaction);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} transaction {}: {}", transaction.provider(), transaction.transactionId(), e.getMessage());
            summary.recordSkipped(SkipReason.MALFORMED);
            return;
        }

        EligibilityDecision decision = eligibilityFilter.evaluate(normalized);
        if (!decision.eligible()) {
            summary.recordSkipped(decision.reason());
            return;
        }

        BigDecimal roundUp = calculator.roundUp(normalized.amount());
        if (roundUp.signum() == 0) {
            summary.recordSkipped(SkipReason.ZERO_ROUND_UP);
            return;
        }

        LedgerEntryResult result;
        try {
            result = ledgerService.accept(connection.getId(), normalized, roundUp);
        } catch (DataIntegrityViolationException e) {
            log.info("Provider transaction {} inserted concurrently, treated as duplicate", transaction.transactionId());
            summary.recordSkipped(SkipReason.DUPLICATE);
            return;
        }

        if (!result.accepted()) {
            summary.recordSkipped(result.skipReason());
            return;
        }
        summary.recordAccepted(result.roundUpAmount());

        if (result.thresholdReached()) {
            triggerThresholdSettlement(result.roundUpConfigId(), summary);
        }
    }

    private void triggerThresholdSettlement(UUID configId, IngestionSummary summary) {
        try {
            SettlementResult settlement = settlementService.triggerSettlement(configId, SettlementTrigger.THRESHOLD);
            if (settlement.donationCreated()) {
                summary.recordSettlementTriggered();
            }
        } catch (ValidationFailedException | InvalidStateException | NotFoundException e) {
            log.warn("Threshold settlement for config {} not started: {}", configId, e.getMessage());
        }
    }
}
