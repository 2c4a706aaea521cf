package com.nosota.roundup.service;

import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.api.model.SettlementTrigger;
import com.nosota.roundup.client.payment.ChargeResult;
import com.nosota.roundup.client.payment.ChargeStatus;
import com.nosota.roundup.client.payment.PaymentProcessorClient;
import com.nosota.roundup.dto.SettlementOpening;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ProcessorException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.Donation;
import com.nosota.roundup.repository.DonationRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for settling accumulated round-ups into donations.
 *
 * <p>Threshold crossings, the month-start sweep and manual requests all enter through
 * {@link #triggerSettlement(UUID, SettlementTrigger)}, which is idempotent while a donation is in flight.
 *
 * <p>Settlement workflow:
 * <pre>
 * 1. Open: lock config, select unsettled round-ups, compute fees, validate destination,
 *    create PENDING donation (one transaction)
 * 2. Request the charge from the payment processor (no transaction held)
 * 3. Record the answer:
 *    a. accepted         → PROCESSING, month total deducted
 *    b. rejected         → FAILED, round-ups released, nothing deducted
 *    c. no answer        → left PENDING for reconciliation; never re-requested blindly
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final DonationRecordService donationRecordService;
    private final PaymentProcessorClient paymentProcessorClient;
    private final DonationRepository donationRepository;
    private final RoundUpConfigRepository roundUpConfigRepository;
    private final RoundUpLedgerService ledgerService;
    private final Clock clock;

    @Value("${roundup.settlement.pending-timeout:PT15M}")
    private Duration pendingTimeout;

    /**
     * Settles the config's unsettled round-ups.
     *
     * @param configId Config to settle
     * @param trigger  What requested the settlement
     * @return Outcome, with the donation created or already in flight
     * @throws NotFoundException         if the config does not exist
     * @throws InvalidStateException     if the config is cancelled or its connection is not ACTIVE
     * @throws ValidationFailedException if the destination cause or organization cannot receive donations
     */
    public SettlementResult triggerSettlement(@NotNull UUID configId, @NotNull SettlementTrigger trigger)
            throws NotFoundException, InvalidStateException, ValidationFailedException {
        SettlementOpening opening = donationRecordService.openSettlement(configId, trigger);
        if (!opening.isOpened()) {
            return opening.skipped();
        }

        UUID donationId = opening.donation().getId();
        ChargeResult charge;
        try {
            charge = paymentProcessorClient.createCharge(opening.chargeRequest());
        } catch (ProcessorException e) {
            if (e.isOutcomeUnknown()) {
                log.warn("Charge for donation {} has unknown outcome, left PENDING for reconciliation: {}",
                        donationId, e.getMessage());
                return new SettlementResult(configId, SettlementOutcome.OUTCOME_UNKNOWN, opening.donation());
            }
            log.warn("Charge for donation {} rejected: {}", donationId, e.getMessage());
            Donation failed = donationRecordService.recordChargeRejected(donationId, e.getMessage());
            return new SettlementResult(configId, SettlementOutcome.CHARGE_REJECTED, failed);
        }

        if (charge.isFailed()) {
            String reason = charge.failureReason() != null ? charge.failureReason() : "Charge declined";
            log.warn("Charge {} for donation {} declined: {}", charge.chargeId(), donationId, reason);
            Donation failed = donationRecordService.recordChargeRejected(donationId, reason);
            return new SettlementResult(configId, SettlementOutcome.CHARGE_REJECTED, failed);
        }

        Donation accepted = donationRecordService.recordChargeAccepted(donationId, charge.chargeId());
        return new SettlementResult(configId, SettlementOutcome.CHARGE_REQUESTED, accepted);
    }

    /**
     * Month-start sweep: settles every enabled config, then starts the new month on every non-cancelled config.
     *
     * @return Number of donations created
     */
    public int runMonthlySweep() {
        int created = 0;
        for (UUID configId : roundUpConfigRepository.findEnabledIdsByStatusNot(RoundUpStatus.CANCELLED)) {
            try {
                if (triggerSettlement(configId, SettlementTrigger.SCHEDULED).donationCreated()) {
                    created++;
                }
            } catch (Exception e) {
                log.warn("Scheduled settlement of config {} failed: {}", configId, e.getMessage());
            }
        }

        int rolled = 0;
        for (UUID configId : roundUpConfigRepository.findIdsByStatusNot(RoundUpStatus.CANCELLED)) {
            if (ledgerService.startNewPeriod(configId)) {
                rolled++;
            }
        }
        log.info("Monthly sweep done: {} donations created, {} configs moved to the new month", created, rolled);
        return created;
    }

    /**
     * Resolves donations stuck in PENDING longer than the timeout by asking the processor
     * for the charge tagged with the donation id.
     *
     * <ul>
     *   <li>charge succeeded → completed</li>
     *   <li>charge processing / needs action → accepted, final result comes by webhook</li>
     *   <li>charge failed or absent → released back to the ledger</li>
     *   <li>lookup failed → retried on the next run</li>
     * </ul>
     *
     * @return Number of donations resolved
     */
    public int recoverStalePendingDonations() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(pendingTimeout);
        List<UUID> stale = donationRepository.findIdsByStatusAndCreatedAtBefore(DonationStatus.PENDING, cutoff);
        int resolved = 0;

        for (UUID donationId : stale) {
            Optional<ChargeResult> charge;
            try {
                charge = paymentProcessorClient.findChargeByDonationId(donationId.toString());
            } catch (ProcessorException e) {
                log.warn("Charge lookup for pending donation {} failed, retrying later: {}", donationId, e.getMessage());
                continue;
            }

            try {
                if (charge.isEmpty()) {
                    log.info("No charge found for pending donation {}, releasing it", donationId);
                    donationRecordService.recordChargeRejected(donationId, "Charge was never created");
                } else if (charge.get().status() == ChargeStatus.SUCCEEDED) {
                    donationRecordService.applyConfirmation(donationId, true, charge.get().chargeId(), null);
                } else if (charge.get().isFailed()) {
                    donationRecordService.recordChargeRejected(donationId,
                            charge.get().failureReason() != null ? charge.get().failureReason() : "Charge declined");
                } else {
                    donationRecordService.recordChargeAccepted(donationId, charge.get().chargeId());
                }
                resolved++;
            } catch (NotFoundException e) {
                log.warn("Pending donation {} disappeared during recovery", donationId);
            }
        }

        if (!stale.isEmpty()) {
            log.info("Pending donation recovery: {} of {} resolved", resolved, stale.size());
        }
        return resolved;
    }

    public Donation getDonation(@NotNull UUID donationId) throws NotFoundException {
        return donationRepository.findById(donationId)
                .orElseThrow(() -> new NotFoundException("Donation not found: " + donationId));
    }

    public Page<Donation> getDonationHistory(@NotNull UUID configId, int page, int size) {
        return donationRepository.findByRoundUpConfigIdOrderByCreatedAtDesc(configId, PageRequest.of(page, size));
    }
}
