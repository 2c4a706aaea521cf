package com.nosota.roundup.service;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.request.CreateRoundUpConfigRequest;
import com.nosota.roundup.api.response.RoundUpSummaryResponse;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.DonationRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import com.nosota.roundup.repository.RoundUpTransactionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Service for round-up configuration management.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Setup on an active connection, with destination and threshold validation</li>
 *   <li>Pause and resume</li>
 *   <li>Queries and the summary view</li>
 * </ul>
 *
 * <p>A connection has at most one active config; the unique {@code active_connection_id} column
 * enforces it against concurrent setups.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RoundUpConfigService {

    private final RoundUpConfigRepository roundUpConfigRepository;
    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpTransactionRepository roundUpTransactionRepository;
    private final DonationRepository donationRepository;
    private final DestinationValidator destinationValidator;
    private final CharitySwitchGuard charitySwitchGuard;
    private final Clock clock;

    @Value("${roundup.threshold.min:3.00}")
    private BigDecimal thresholdMin;

    @Value("${roundup.threshold.max:1000.00}")
    private BigDecimal thresholdMax;

    @Value("${roundup.currency.plaid:USD}")
    private String plaidCurrency;

    @Value("${roundup.currency.basiq:AUD}")
    private String basiqCurrency;

    /**
     * Sets up round-ups on a linked connection.
     *
     * @param request Setup request
     * @return The new PENDING config
     * @throws NotFoundException         if the connection does not exist or belongs to another user
     * @throws InvalidStateException     if the connection is not ACTIVE or already has an active config
     * @throws ValidationFailedException if the threshold is out of range or the destination cannot receive donations
     */
    @Transactional(rollbackOn = Exception.class)
    public RoundUpConfig createRoundUpConfig(@NotNull @Valid CreateRoundUpConfigRequest request)
            throws NotFoundException, InvalidStateException, ValidationFailedException {
        validateThreshold(request.monthlyThreshold());
        destinationValidator.revalidate(request.organizationId(), request.causeId());

        // locked so a concurrent revocation cannot slip between the check and the insert
        BankConnection connection = bankConnectionRepository.getOneForUpdate(request.bankConnectionId());
        if (connection == null || !connection.getUserId().equals(request.userId())) {
            throw new NotFoundException("Bank connection not found: " + request.bankConnectionId());
        }
        RoundUpLedgerService.requireActive(connection);
        if (roundUpConfigRepository.findActiveConfigId(connection.getId()).isPresent()) {
            throw new InvalidStateException("Bank connection " + connection.getId() + " already has an active round-up config");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        RoundUpConfig config = new RoundUpConfig();
        config.setUserId(request.userId());
        config.setBankConnectionId(connection.getId());
        config.setActiveConnectionId(connection.getId());
        config.setOrganizationId(request.organizationId());
        config.setCauseId(request.causeId());
        config.setPaymentMethodId(request.paymentMethodId());
        config.setMonthlyThreshold(request.monthlyThreshold());
        config.setCoverFees(request.coverFees());
        config.setCurrency(currencyOf(connection.getProvider()));
        config.setSpecialMessage(request.specialMessage());
        config.setCurrentMonthTotal(BigDecimal.ZERO);
        config.setTotalAccumulated(BigDecimal.ZERO);
        config.setCurrentPeriodStart(now.toLocalDate().withDayOfMonth(1));
        config.setEnabled(true);
        config.setStatus(RoundUpStatus.PENDING);
        config.setSettlementSequence(0);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);

        try {
            RoundUpConfig saved = roundUpConfigRepository.saveAndFlush(config);
            log.info("Created round-up config {} on connection {} for user {}: org={}, cause={}, threshold={}",
                    saved.getId(), connection.getId(), request.userId(), request.organizationId(),
                    request.causeId(), request.monthlyThreshold());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new InvalidStateException(
                    "Bank connection " + connection.getId() + " already has an active round-up config", e);
        }
    }

    public RoundUpConfig getRoundUpConfig(@NotNull UUID configId) throws NotFoundException {
        return roundUpConfigRepository.findById(configId)
                .orElseThrow(() -> new NotFoundException("Round-up config not found: " + configId));
    }

    public List<RoundUpConfig> listRoundUpConfigs(@NotNull Long userId) {
        return roundUpConfigRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public RoundUpSummaryResponse getRoundUpSummary(@NotNull UUID configId) throws NotFoundException {
        RoundUpConfig config = getRoundUpConfig(configId);
        BigDecimal totalDonated = donationRepository.sumBaseAmount(configId, DonationStatus.COMPLETED);
        long unsettled = roundUpTransactionRepository.countByRoundUpConfigIdAndStatus(
                configId, RoundUpTransactionStatus.PROCESSED);

        return new RoundUpSummaryResponse(
                config.getId(),
                config.getStatus(),
                config.getCurrentMonthTotal(),
                config.getTotalAccumulated(),
                totalDonated,
                unsettled,
                config.getMonthlyThreshold(),
                charitySwitchGuard.nextSwitchAllowedAt(config.getLastCharitySwitch(), LocalDateTime.now(clock))
        );
    }

    /**
     * Stops accumulation; ingestion is rejected and sweeps skip the config until it is resumed.
     */
    @Transactional(rollbackOn = Exception.class)
    public RoundUpConfig pauseRoundUps(@NotNull UUID configId) throws NotFoundException, InvalidStateException {
        RoundUpConfig config = lockConfig(configId);
        if (config.isCancelled()) {
            throw new InvalidStateException("Round-up config " + configId + " is cancelled");
        }
        if (config.isEnabled()) {
            config.setEnabled(false);
            config.setUpdatedAt(LocalDateTime.now(clock));
            roundUpConfigRepository.save(config);
            log.info("Round-ups paused for config {}", configId);
        }
        return config;
    }

    /**
     * Resumes accumulation. A FAILED config goes back to PENDING so the next cycle retries.
     */
    @Transactional(rollbackOn = Exception.class)
    public RoundUpConfig resumeRoundUps(@NotNull UUID configId) throws NotFoundException, InvalidStateException {
        RoundUpConfig config = lockConfig(configId);
        if (config.isCancelled()) {
            throw new InvalidStateException("Round-up config " + configId + " is cancelled");
        }
        config.setEnabled(true);
        if (config.getStatus() == RoundUpStatus.FAILED) {
            config.setStatus(RoundUpStatus.PENDING);
        }
        config.setUpdatedAt(LocalDateTime.now(clock));
        roundUpConfigRepository.save(config);
        log.info("Round-ups resumed for config {}", configId);
        return config;
    }

    // ==================== Private Helper Methods ====================

    private void validateThreshold(BigDecimal threshold) throws ValidationFailedException {
        if (threshold == null) {
            return;
        }
        if (threshold.compareTo(thresholdMin) < 0 || threshold.compareTo(thresholdMax) > 0) {
            throw new ValidationFailedException(String.format(
                    "Monthly threshold must be between %s and %s, or empty for no limit", thresholdMin, thresholdMax));
        }
    }

    private RoundUpConfig lockConfig(UUID configId) throws NotFoundException {
        RoundUpConfig config = roundUpConfigRepository.getOneForUpdate(configId);
        if (config == null) {
            throw new NotFoundException("Round-up config not found: " + configId);
        }
        return config;
    }

    private String currencyOf(BankProvider provider) {
        return provider == BankProvider.BASIQ ? basiqCurrency : plaidCurrency;
    }
}
