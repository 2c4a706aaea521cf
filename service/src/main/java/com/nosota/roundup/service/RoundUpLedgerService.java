package com.nosota.roundup.service;

import com.nosota.roundup.api.model.ConnectionStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.dto.LedgerEntryResult;
import com.nosota.roundup.dto.NormalizedTransaction;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.model.RoundUpTransaction;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import com.nosota.roundup.repository.RoundUpTransactionRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Round-up accumulator.
 *
 * <p>Each accepted round-up runs in its own transaction holding the config row lock:
 * <pre>
 * 1. Lock the connection's active config (SELECT ... FOR UPDATE)
 * 2. Check connection ACTIVE, config not cancelled and enabled
 * 3. Skip duplicates and foreign currencies
 * 4. Roll the month if a new one started
 * 5. Insert the RoundUpTransaction (PROCESSED)
 * 6. currentMonthTotal += roundUp, totalAccumulated += roundUp
 * 7. Report whether the monthly threshold is reached
 * </pre>
 *
 * <p>{@code currentMonthTotal} always equals the sum of the config's PROCESSED round-ups, except
 * across a monthly reset which zeroes it without touching the round-ups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoundUpLedgerService {

    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpConfigRepository roundUpConfigRepository;
    private final RoundUpTransactionRepository roundUpTransactionRepository;
    private final Clock clock;

    /**
     * Accumulates one round-up on the connection's active config.
     *
     * @param connectionId Connection the transaction was reported for
     * @param transaction  Eligible normalized transaction
     * @param roundUp      Positive round-up amount
     * @return Accepted with the new total, or skipped with the reason
     * @throws NotFoundException     if the connection or its active config does not exist
     * @throws InvalidStateException if the connection is not ACTIVE or the config is cancelled or paused
     * @throws org.springframework.dao.DataIntegrityViolationException if a concurrent delivery inserted the
     *                               same provider transaction first
     */
    @Transactional(rollbackOn = Exception.class)
    public LedgerEntryResult accept(UUID connectionId, NormalizedTransaction transaction, BigDecimal roundUp)
            throws NotFoundException, InvalidStateException {
        if (roundUp == null || roundUp.signum() <= 0) {
            throw new IllegalArgumentException("Round-up must be positive: " + roundUp);
        }

        Optional<UUID> activeConfigId = roundUpConfigRepository.findActiveConfigId(connectionId);
        RoundUpConfig config = activeConfigId.map(roundUpConfigRepository::getOneForUpdate).orElse(null);

        // read after the config lock so a committed revocation is visible
        BankConnection connection = bankConnectionRepository.findById(connectionId)
                .orElseThrow(() -> new NotFoundException("Bank connection not found: " + connectionId));
        requireActive(connection);
        if (config == null) {
            throw new NotFoundException("No active round-up config for connection " + connectionId);
        }
        UUID configId = config.getId();
        if (config.isCancelled()) {
            throw new InvalidStateException("Round-up config " + configId + " is cancelled");
        }
        if (!config.isEnabled()) {
            throw new InvalidStateException("Round-ups are paused for config " + configId);
        }

        if (roundUpTransactionRepository.existsByProviderTransactionId(transaction.providerTransactionId())) {
            log.debug("Duplicate provider transaction {} absorbed", transaction.providerTransactionId());
            return LedgerEntryResult.skipped(configId, SkipReason.DUPLICATE);
        }
        if (transaction.currency() == null || !transaction.currency().equalsIgnoreCase(config.getCurrency())) {
            log.debug("Transaction {} in {} skipped, config {} settles in {}",
                    transaction.providerTransactionId(), transaction.currency(), configId, config.getCurrency());
            return LedgerEntryResult.skipped(configId, SkipReason.UNSUPPORTED_CURRENCY);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        rollPeriodIfNeeded(config, now.toLocalDate());

        RoundUpTransaction entry = new RoundUpTransaction();
        entry.setUserId(connection.getUserId());
        entry.setBankConnectionId(connectionId);
        entry.setRoundUpConfigId(configId);
        entry.setProvider(transaction.provider());
        entry.setProviderTransactionId(transaction.providerTransactionId());
        entry.setOriginalAmount(transaction.amount());
        entry.setRoundUpAmount(roundUp);
        entry.setCurrency(config.getCurrency());
        entry.setTransactionDate(transaction.date() != null ? transaction.date() : now.toLocalDate());
        entry.setTransactionName(truncate(transaction.name(), 500));
        entry.setCategories(transaction.categories());
        entry.setStatus(RoundUpTransactionStatus.PROCESSED);
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        roundUpTransactionRepository.saveAndFlush(entry);

        config.setCurrentMonthTotal(config.getCurrentMonthTotal().add(roundUp));
        config.setTotalAccumulated(config.getTotalAccumulated().add(roundUp));
        if (config.getStatus() == RoundUpStatus.COMPLETED) {
            config.setStatus(RoundUpStatus.PENDING);
        }
        config.setUpdatedAt(now);
        roundUpConfigRepository.save(config);

        boolean thresholdReached = config.getMonthlyThreshold() != null
                && config.getCurrentMonthTotal().compareTo(config.getMonthlyThreshold()) >= 0;

        log.debug("Round-up {} accepted on config {}: total {}{}", roundUp, configId,
                config.getCurrentMonthTotal(), thresholdReached ? " (threshold reached)" : "");

        return LedgerEntryResult.accepted(configId, roundUp, config.getCurrentMonthTotal(), thresholdReached);
    }

    /**
     * Starts the current month on a config: the monthly total is reset, round-ups are left as they are.
     *
     * @return true if the config moved to a new month
     */
    @Transactional
    public boolean startNewPeriod(UUID configId) {
        RoundUpConfig config = roundUpConfigRepository.getOneForUpdate(configId);
        if (config == null || config.isCancelled()) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        boolean rolled = rollPeriodIfNeeded(config, now.toLocalDate());
        if (rolled) {
            config.setUpdatedAt(now);
            roundUpConfigRepository.save(config);
        }
        return rolled;
    }

    public RoundUpTransaction getRoundUpTransaction(UUID transactionId) throws NotFoundException {
        return roundUpTransactionRepository.findById(transactionId)
                .orElseThrow(() -> new NotFoundException("Round-up transaction not found: " + transactionId));
    }

    /**
     * Lists a config's round-ups, newest first.
     *
     * @param configId Config the round-ups accumulated on
     * @param status   Only round-ups in this status, or all when null
     * @throws NotFoundException if the config does not exist
     */
    public Page<RoundUpTransaction> getRoundUpTransactions(UUID configId, RoundUpTransactionStatus status,
                                                           int page, int size) throws NotFoundException {
        if (!roundUpConfigRepository.existsById(configId)) {
            throw new NotFoundException("Round-up config not found: " + configId);
        }
        PageRequest pageRequest = PageRequest.of(page, size);
        if (status == null) {
            return roundUpTransactionRepository.findByRoundUpConfigIdOrderByCreatedAtDesc(configId, pageRequest);
        }
        return roundUpTransactionRepository.findByRoundUpConfigIdAndStatusOrderByCreatedAtDesc(
                configId, status, pageRequest);
    }

    // ==================== Private Helper Methods ====================

    static void requireActive(BankConnection connection) throws InvalidStateException {
        if (connection.getStatus() != ConnectionStatus.ACTIVE) {
            throw new InvalidStateException(String.format(
                    "Bank connection %s is %s, operation not permitted", connection.getId(), connection.getStatus()));
        }
    }

    private boolean rollPeriodIfNeeded(RoundUpConfig config, LocalDate today) {
        LocalDate monthStart = today.withDayOfMonth(1);
        if (!config.getCurrentPeriodStart().isBefore(monthStart)) {
            return false;
        }
        log.info("Config {} starts period {}: monthly total {} reset", config.getId(), monthStart,
                config.getCurrentMonthTotal());
        config.setCurrentMonthTotal(BigDecimal.ZERO);
        config.setCurrentPeriodStart(monthStart);
        return true;
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
