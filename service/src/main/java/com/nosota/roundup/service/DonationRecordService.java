package com.nosota.roundup.service;

import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.api.model.SettlementTrigger;
import com.nosota.roundup.client.directory.OrganizationPayoutStatus;
import com.nosota.roundup.client.payment.ChargeRequest;
import com.nosota.roundup.dto.FeeBreakdown;
import com.nosota.roundup.dto.ReconciliationOutcome;
import com.nosota.roundup.dto.SettlementOpening;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.Donation;
import com.nosota.roundup.model.DonationTransaction;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.model.RoundUpTransaction;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.DonationRepository;
import com.nosota.roundup.repository.DonationTransactionRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import com.nosota.roundup.repository.RoundUpTransactionRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional steps of a settlement.
 *
 * <p>A settlement is written in two phases around the processor call, which is never made inside a
 * database transaction:
 * <pre>
 * Phase 1  openSettlement          Donation PENDING, round-ups assigned to it
 *          --- charge request ---
 * Phase 2  recordChargeAccepted    Donation + round-ups PROCESSING, month total deducted
 *      or  recordChargeRejected    Donation FAILED, round-ups released, nothing deducted
 * Final    applyConfirmation       COMPLETED/DONATED, or FAILED with the deducted amount restored
 * </pre>
 * A crash between the phases leaves a PENDING donation that the recovery sweep resolves.
 *
 * <p>Every method locks the config row before touching the donation, so all writes of one config are serialized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DonationRecordService {

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final List<DonationStatus> IN_FLIGHT = List.of(DonationStatus.PENDING, DonationStatus.PROCESSING);

    private final RoundUpConfigRepository roundUpConfigRepository;
    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpTransactionRepository roundUpTransactionRepository;
    private final DonationRepository donationRepository;
    private final DonationTransactionRepository donationTransactionRepository;
    private final DestinationValidator destinationValidator;
    private final FeeCalculator feeCalculator;
    private final DonationStatusStateMachine stateMachine;
    private final Clock clock;

    @Value("${roundup.settlement.min-amount:1.00}")
    private BigDecimal minAmount;

    /**
     * Phase 1: selects the unsettled round-ups and records a PENDING donation for them.
     *
     * @return The opened donation with its charge request, or why nothing was opened
     *         (duplicate trigger while a donation is in flight, nothing to settle)
     * @throws NotFoundException         if the config does not exist
     * @throws InvalidStateException     if the config is cancelled or its connection is not ACTIVE
     * @throws ValidationFailedException if the destination cannot receive donations
     */
    @Transactional(rollbackOn = Exception.class)
    public SettlementOpening openSettlement(UUID configId, SettlementTrigger trigger)
            throws NotFoundException, InvalidStateException, ValidationFailedException {
        RoundUpConfig config = roundUpConfigRepository.getOneForUpdate(configId);
        if (config == null) {
            throw new NotFoundException("Round-up config not found: " + configId);
        }
        if (config.isCancelled()) {
            throw new InvalidStateException("Round-up config " + configId + " is cancelled");
        }
        BankConnection connection = bankConnectionRepository.findById(config.getBankConnectionId())
                .orElseThrow(() -> new NotFoundException("Bank connection not found: " + config.getBankConnectionId()));
        RoundUpLedgerService.requireActive(connection);

        Optional<Donation> inFlight = donationRepository.findFirstByRoundUpConfigIdAndStatusIn(configId, IN_FLIGHT);
        if (inFlight.isPresent()) {
            log.info("Settlement of config {} already in flight as donation {} ({}), {} trigger absorbed",
                    configId, inFlight.get().getId(), inFlight.get().getStatus(), trigger);
            return SettlementOpening.skipped(
                    new SettlementResult(configId, SettlementOutcome.DUPLICATE, inFlight.get()));
        }

        List<RoundUpTransaction> unsettled = roundUpTransactionRepository.findUnsettled(configId);
        if (unsettled.isEmpty()) {
            log.debug("Nothing to settle for config {}", configId);
            return SettlementOpening.skipped(SettlementResult.nothingToSettle(configId));
        }

        BigDecimal baseAmount = unsettled.stream()
                .map(RoundUpTransaction::getRoundUpAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (baseAmount.compareTo(minAmount) < 0) {
            log.info("Config {} has {} to settle, below minimum {}, deferred", configId, baseAmount, minAmount);
            return SettlementOpening.skipped(SettlementResult.nothingToSettle(configId));
        }

        FeeBreakdown fees = feeCalculator.calculate(baseAmount, config.isCoverFees());
        if (fees.netAmount().signum() <= 0) {
            log.info("Config {}: fees {} consume base {}, deferred", configId, fees.totalFee(), baseAmount);
            return SettlementOpening.skipped(SettlementResult.nothingToSettle(configId));
        }

        OrganizationPayoutStatus payout = destinationValidator.revalidate(config.getOrganizationId(), config.getCauseId());

        LocalDateTime now = LocalDateTime.now(clock);
        String period = now.format(PERIOD_FORMAT);
        int sequence = config.getSettlementSequence() + 1;
        config.setSettlementSequence(sequence);
        config.setLastDonationAttempt(now);
        config.setUpdatedAt(now);
        roundUpConfigRepository.save(config);

        Donation donation = new Donation();
        donation.setRoundUpConfigId(configId);
        donation.setUserId(config.getUserId());
        donation.setOrganizationId(config.getOrganizationId());
        donation.setCauseId(config.getCauseId());
        donation.setPaymentMethodId(config.getPaymentMethodId());
        donation.setDestinationAccount(payout.connectedAccountId());
        donation.setBaseAmount(fees.baseAmount());
        donation.setProcessorFee(fees.processorFee());
        donation.setTaxAmount(fees.taxAmount());
        donation.setTotalFee(fees.totalFee());
        donation.setNetAmount(fees.netAmount());
        donation.setTotalCharged(fees.totalCharged());
        donation.setCoverFees(fees.coverFees());
        donation.setCurrency(config.getCurrency());
        donation.setSpecialMessage(config.getSpecialMessage());
        donation.setStatus(DonationStatus.PENDING);
        donation.setTrigger(trigger);
        donation.setIdempotencyKey(String.format("roundup_%s_%s_%d", configId, period, sequence));
        donation.setSettlementPeriod(period);
        donation.setTransactionCount(unsettled.size());
        donation.setDeductedAmount(BigDecimal.ZERO);
        donation.setCreatedAt(now);
        donation.setUpdatedAt(now);
        Donation saved = donationRepository.save(donation);

        for (RoundUpTransaction transaction : unsettled) {
            DonationTransaction link = new DonationTransaction();
            link.setDonationId(saved.getId());
            link.setRoundUpTransactionId(transaction.getId());
            link.setRoundUpAmount(transaction.getRoundUpAmount());
            link.setCreatedAt(now);
            donationTransactionRepository.save(link);

            transaction.setDonationId(saved.getId());
            transaction.setDonationAttemptedAt(now);
            transaction.setUpdatedAt(now);
        }
        roundUpTransactionRepository.saveAll(unsettled);

        log.info("Opened donation {} for config {} ({} trigger): {} round-ups, base={}, fee={}, tax={}, charged={}, net={}",
                saved.getId(), configId, trigger, unsettled.size(), fees.baseAmount(), fees.processorFee(),
                fees.taxAmount(), fees.totalCharged(), fees.netAmount());

        return SettlementOpening.opened(saved, buildChargeRequest(saved));
    }

    /**
     * Phase 2, charge accepted: donation and round-ups PROCESSING, base amount taken off the month total.
     *
     * @return The updated donation; unchanged if it already left PENDING
     */
    @Transactional
    public Donation recordChargeAccepted(UUID donationId, String chargeId) {
        RoundUpConfig config = lockConfigOf(donationId);
        Donation donation = loadDonation(donationId);
        if (donation.getStatus() != DonationStatus.PENDING) {
            log.info("Donation {} already {}, accept of charge {} ignored", donationId, donation.getStatus(), chargeId);
            return donation;
        }
        markAccepted(config, donation, chargeId, LocalDateTime.now(clock));
        return donation;
    }

    /**
     * Phase 2, charge rejected: donation FAILED, round-ups released for the next cycle, config FAILED.
     * The month total was not deducted and stays as it is.
     *
     * @return The updated donation; unchanged if it already left PENDING
     */
    @Transactional
    public Donation recordChargeRejected(UUID donationId, String reason) {
        RoundUpConfig config = lockConfigOf(donationId);
        Donation donation = loadDonation(donationId);
        if (donation.getStatus() != DonationStatus.PENDING) {
            log.info("Donation {} already {}, rejection ignored", donationId, donation.getStatus());
            return donation;
        }
        markFailed(config, donation, "Payment failed, will retry: " + reason, LocalDateTime.now(clock));
        return donation;
    }

    /**
     * Final processor confirmation.
     *
     * <p>Success: donation COMPLETED, round-ups DONATED. Failure: donation FAILED, round-ups released and
     * the deducted base amount restored to the month total. A donation already COMPLETED or FAILED is a duplicate.
     *
     * @param donationId    Donation from the charge metadata
     * @param succeeded     Whether the charge settled
     * @param chargeId      Processor charge reference, may be null
     * @param failureReason Processor message for failures
     * @throws NotFoundException if the donation does not exist
     */
    @Transactional
    public ReconciliationOutcome applyConfirmation(UUID donationId, boolean succeeded, String chargeId,
                                                   String failureReason) throws NotFoundException {
        UUID configId = donationRepository.findConfigIdById(donationId)
                .orElseThrow(() -> new NotFoundException("Donation not found: " + donationId));
        RoundUpConfig config = roundUpConfigRepository.getOneForUpdate(configId);
        Donation donation = loadDonation(donationId);

        if (stateMachine.isFinalState(donation.getStatus())) {
            log.info("Donation {} already {}, {} confirmation absorbed",
                    donationId, donation.getStatus(), succeeded ? "success" : "failure");
            return ReconciliationOutcome.DUPLICATE;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (succeeded) {
            if (donation.getStatus() == DonationStatus.PENDING) {
                markAccepted(config, donation, chargeId, now);
            }
            markCompleted(config, donation, chargeId, now);
        } else {
            String reason = failureReason != null ? failureReason : "Charge failed at the payment processor";
            markFailed(config, donation, reason, now);
        }
        return ReconciliationOutcome.APPLIED;
    }

    // ==================== Private Helper Methods ====================

    private ChargeRequest buildChargeRequest(Donation donation) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("donationId", donation.getId().toString());
        metadata.put("roundUpConfigId", donation.getRoundUpConfigId().toString());
        metadata.put("userId", donation.getUserId().toString());
        metadata.put("organizationId", donation.getOrganizationId().toString());
        metadata.put("causeId", donation.getCauseId().toString());

        return ChargeRequest.builder()
                .paymentMethodId(donation.getPaymentMethodId())
                .amount(donation.getTotalCharged())
                .currency(donation.getCurrency())
                .destinationAccount(donation.getDestinationAccount())
                .transferAmount(donation.getNetAmount())
                .idempotencyKey(donation.getIdempotencyKey())
                .description("Round-up donation")
                .metadata(metadata)
                .build();
    }

    private void markAccepted(RoundUpConfig config, Donation donation, String chargeId, LocalDateTime now) {
        stateMachine.validateTransition(donation.getStatus(), DonationStatus.PROCESSING);
        donation.setStatus(DonationStatus.PROCESSING);
        donation.setProcessorChargeId(chargeId);
        donation.setChargeRequestedAt(now);
        donation.setUpdatedAt(now);

        List<RoundUpTransaction> transactions = roundUpTransactionRepository.findByDonationId(donation.getId());
        for (RoundUpTransaction transaction : transactions) {
            transaction.setStatus(RoundUpTransactionStatus.PROCESSING);
            transaction.setUpdatedAt(now);
        }
        roundUpTransactionRepository.saveAll(transactions);

        if (!config.isCancelled()) {
            // round-ups from before a monthly reset are no longer part of the month total
            BigDecimal deducted = donation.getBaseAmount().min(config.getCurrentMonthTotal());
            config.setCurrentMonthTotal(config.getCurrentMonthTotal().subtract(deducted));
            config.setStatus(RoundUpStatus.PROCESSING);
            config.setLastFailureReason(null);
            config.setUpdatedAt(now);
            roundUpConfigRepository.save(config);
            donation.setDeductedAmount(deducted);
        }
        donationRepository.save(donation);

        log.info("Donation {} PENDING -> PROCESSING (charge {}), config {} month total now {}",
                donation.getId(), chargeId, config.getId(), config.getCurrentMonthTotal());
    }

    private void markCompleted(RoundUpConfig config, Donation donation, String chargeId, LocalDateTime now) {
        stateMachine.validateTransition(donation.getStatus(), DonationStatus.COMPLETED);
        donation.setStatus(DonationStatus.COMPLETED);
        if (chargeId != null) {
            donation.setProcessorChargeId(chargeId);
        }
        donation.setCompletedAt(now);
        donation.setUpdatedAt(now);
        donationRepository.save(donation);

        List<RoundUpTransaction> transactions = roundUpTransactionRepository.findByDonationId(donation.getId());
        for (RoundUpTransaction transaction : transactions) {
            transaction.setStatus(RoundUpTransactionStatus.DONATED);
            transaction.setDonatedAt(now);
            transaction.setUpdatedAt(now);
        }
        roundUpTransactionRepository.saveAll(transactions);

        if (!config.isCancelled()) {
            config.setStatus(RoundUpStatus.COMPLETED);
            config.setUpdatedAt(now);
            roundUpConfigRepository.save(config);
        }

        log.info("Donation {} COMPLETED: {} round-ups donated, net {} {} to cause {}",
                donation.getId(), transactions.size(), donation.getNetAmount(), donation.getCurrency(),
                donation.getCauseId());
    }

    private void markFailed(RoundUpConfig config, Donation donation, String reason, LocalDateTime now) {
        DonationStatus previous = donation.getStatus();
        stateMachine.validateTransition(previous, DonationStatus.FAILED);
        donation.setStatus(DonationStatus.FAILED);
        donation.setFailureReason(reason);
        donation.setUpdatedAt(now);

        // a cancelled config is frozen: its round-ups end FAILED instead of waiting for another cycle
        RoundUpTransactionStatus releasedStatus = config.isCancelled()
                ? RoundUpTransactionStatus.FAILED
                : RoundUpTransactionStatus.PROCESSED;
        List<RoundUpTransaction> transactions = roundUpTransactionRepository.findByDonationId(donation.getId());
        for (RoundUpTransaction transaction : transactions) {
            transaction.setStatus(releasedStatus);
            transaction.setDonationId(null);
            transaction.setLastPaymentFailure(now);
            transaction.setLastPaymentFailureReason(reason);
            transaction.setUpdatedAt(now);
        }
        roundUpTransactionRepository.saveAll(transactions);

        boolean restored = !config.isCancelled() && donation.getDeductedAmount().signum() > 0;
        if (restored) {
            config.setCurrentMonthTotal(config.getCurrentMonthTotal().add(donation.getDeductedAmount()));
        }
        if (!config.isCancelled()) {
            config.setStatus(RoundUpStatus.FAILED);
            config.setLastFailureReason(reason);
            config.setUpdatedAt(now);
            roundUpConfigRepository.save(config);
        }
        donationRepository.save(donation);

        log.warn("Donation {} {} -> FAILED ({}): {} round-ups released{}, config {} month total {}",
                donation.getId(), previous, reason, transactions.size(),
                restored ? " and " + donation.getDeductedAmount() + " restored" : "",
                config.getId(), config.getCurrentMonthTotal());
    }

    private RoundUpConfig lockConfigOf(UUID donationId) {
        UUID configId = donationRepository.findConfigIdById(donationId)
                .orElseThrow(() -> new IllegalStateException("Donation not found: " + donationId));
        return roundUpConfigRepository.getOneForUpdate(configId);
    }

    private Donation loadDonation(UUID donationId) {
        return donationRepository.findById(donationId)
                .orElseThrow(() -> new IllegalStateException("Donation not found: " + donationId));
    }
}
