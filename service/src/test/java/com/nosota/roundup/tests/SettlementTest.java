package com.nosota.roundup.tests;

import com.nosota.roundup.TestBase;
import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.api.model.SettlementTrigger;
import com.nosota.roundup.client.payment.ChargeRequest;
import com.nosota.roundup.client.payment.ChargeResult;
import com.nosota.roundup.client.payment.ChargeStatus;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.dto.PaymentEvent;
import com.nosota.roundup.dto.PaymentEventType;
import com.nosota.roundup.dto.ReconciliationOutcome;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.fake.FakePaymentProcessorClient;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.Donation;
import com.nosota.roundup.model.DonationTransaction;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.repository.DonationTransactionRepository;
import com.nosota.roundup.service.PaymentReconciliationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for settlement: threshold crossings, charge outcomes, confirmations and recovery.
 *
 * <p>After every step the monthly total must equal the sum of the config's PROCESSED round-ups.
 */
@DisplayName("Settlement Tests")
public class SettlementTest extends TestBase {

    @Autowired
    private PaymentReconciliationService paymentReconciliationService;

    @Autowired
    private DonationTransactionRepository donationTransactionRepository;

    @Test
    @DisplayName("Crossing the threshold opens a donation for all unsettled round-ups")
    void thresholdCrossingSettles() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, "3.00");

        IngestionSummary summary = ingest(connection,
                plaidPurchase(connection, "4.01"),
                plaidPurchase(connection, "7.01"),
                plaidPurchase(connection, "2.01"),
                plaidPurchase(connection, "5.50"));

        assertThat(summary.getAccepted()).isEqualTo(4);
        assertThat(summary.getSettlementsTriggered()).isEqualTo(1);

        Donation donation = singleDonation(config);
        assertThat(donation.getStatus()).isEqualTo(DonationStatus.PROCESSING);
        assertThat(donation.getTrigger()).isEqualTo(SettlementTrigger.THRESHOLD);
        assertThat(donation.getTransactionCount()).isEqualTo(4);
        assertThat(donation.getBaseAmount()).isEqualByComparingTo("3.47");
        assertThat(donation.getProcessorFee()).isEqualByComparingTo("0.40");
        assertThat(donation.getTaxAmount()).isEqualByComparingTo("0.04");
        assertThat(donation.getNetAmount()).isEqualByComparingTo("3.03");
        assertThat(donation.getTotalCharged()).isEqualByComparingTo("3.47");
        assertThat(donation.getCurrency()).isEqualTo("USD");
        assertThat(donation.getIdempotencyKey()).isEqualTo(String.format("roundup_%s_%s_1",
                config.getId(), LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM"))));

        ChargeRequest request = paymentProcessor.getRequests().get(0);
        assertThat(request.amount()).isEqualByComparingTo("3.47");
        assertThat(request.transferAmount()).isEqualByComparingTo("3.03");
        assertThat(request.destinationAccount()).isEqualTo("acct_" + config.getOrganizationId());
        assertThat(request.idempotencyKey()).isEqualTo(donation.getIdempotencyKey());
        assertThat(request.metadata()).containsEntry("donationId", donation.getId().toString());

        RoundUpConfig reloaded = reload(config);
        assertThat(reloaded.getStatus()).isEqualTo(RoundUpStatus.PROCESSING);
        assertThat(reloaded.getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(reloaded.getTotalAccumulated()).isEqualByComparingTo("3.47");
        assertThat(roundUpTransactionRepository.findByDonationId(donation.getId()))
                .hasSize(4)
                .allMatch(entry -> entry.getStatus() == RoundUpTransactionStatus.PROCESSING);
        assertMonthTotalMatchesLedger(config);
    }

    @Test
    @DisplayName("Fees are added on top of the charge when the donor covers them")
    void donorCoversFees() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null, true);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"),
                plaidPurchase(connection, "2.01"), plaidPurchase(connection, "5.50"));

        SettlementResult result = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(result.outcome()).isEqualTo(SettlementOutcome.CHARGE_REQUESTED);
        assertThat(result.donation().getNetAmount()).isEqualByComparingTo("3.47");
        assertThat(result.donation().getTotalCharged()).isEqualByComparingTo("3.91");
        assertThat(paymentProcessor.getRequests().get(0).amount()).isEqualByComparingTo("3.91");
    }

    @Test
    @DisplayName("Round-ups arriving while a donation is in flight wait for the next cycle")
    void roundUpsDuringFlightStayUnsettled() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));
        Donation first = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).donation();

        ingest(connection, plaidPurchase(connection, "1.10"));
        SettlementResult duplicate = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(duplicate.outcome()).isEqualTo(SettlementOutcome.DUPLICATE);
        assertThat(duplicate.donation().getId()).isEqualTo(first.getId());
        assertThat(paymentProcessor.getRequests()).hasSize(1);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("0.90");
        assertMonthTotalMatchesLedger(config);

        confirm(first, PaymentEventType.CHARGE_SUCCEEDED, null);
        ingest(connection, plaidPurchase(connection, "3.90"));
        SettlementResult second = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(second.outcome()).isEqualTo(SettlementOutcome.CHARGE_REQUESTED);
        assertThat(second.donation().getBaseAmount()).isEqualByComparingTo("1.00");
        assertThat(second.donation().getIdempotencyKey()).endsWith("_2");
        assertMonthTotalMatchesLedger(config);
    }

    @Test
    @DisplayName("Successful confirmation completes the donation; re-delivery is a duplicate")
    void successConfirmation() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));
        Donation donation = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).donation();

        assertThat(confirm(donation, PaymentEventType.CHARGE_SUCCEEDED, null)).isEqualTo(ReconciliationOutcome.APPLIED);
        assertThat(confirm(donation, PaymentEventType.CHARGE_SUCCEEDED, null)).isEqualTo(ReconciliationOutcome.DUPLICATE);
        assertThat(confirm(donation, PaymentEventType.CHARGE_FAILED, "late failure"))
                .isEqualTo(ReconciliationOutcome.DUPLICATE);

        Donation completed = donationRepository.findById(donation.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(DonationStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(roundUpTransactionRepository.findByDonationId(donation.getId()))
                .allMatch(entry -> entry.getStatus() == RoundUpTransactionStatus.DONATED && entry.getDonatedAt() != null);

        RoundUpConfig reloaded = reload(config);
        assertThat(reloaded.getStatus()).isEqualTo(RoundUpStatus.COMPLETED);
        assertThat(reloaded.getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(roundUpConfigService.getRoundUpSummary(config.getId()).totalDonated()).isEqualByComparingTo("1.98");
    }

    @Test
    @DisplayName("Failure after acceptance restores the monthly total and releases the round-ups")
    void failureAfterAcceptanceRestores() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));
        Donation donation = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).donation();
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);

        confirm(donation, PaymentEventType.CHARGE_FAILED, "Your card has insufficient funds.");

        Donation failed = donationRepository.findById(donation.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(DonationStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo("Your card has insufficient funds.");

        RoundUpConfig reloaded = reload(config);
        assertThat(reloaded.getStatus()).isEqualTo(RoundUpStatus.FAILED);
        assertThat(reloaded.getCurrentMonthTotal()).isEqualByComparingTo("1.98");
        assertThat(reloaded.getLastFailureReason()).isEqualTo("Your card has insufficient funds.");
        assertThat(roundUpTransactionRepository.findUnsettled(config.getId())).hasSize(2);
        assertThat(donationTransactionRepository.findByDonationId(donation.getId()))
                .extracting(DonationTransaction::getRoundUpAmount)
                .containsExactlyInAnyOrder(new BigDecimal("0.99"), new BigDecimal("0.99"));
        assertMonthTotalMatchesLedger(config);

        SettlementResult retry = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);
        assertThat(retry.outcome()).isEqualTo(SettlementOutcome.CHARGE_REQUESTED);
        assertThat(retry.donation().getBaseAmount()).isEqualByComparingTo("1.98");
        assertThat(retry.donation().getIdempotencyKey()).endsWith("_2");
    }

    @Test
    @DisplayName("A failed charge restores only what was taken off the month total")
    void failureAcrossMonthRestoresOnlyDeductedAmount() throws Exception {
        LocalDate firstMonth = LocalDate.now(clock).withDayOfMonth(15);
        clock.set(firstMonth.atTime(10, 0));
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.DECLINE);
        assertThat(settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).outcome())
                .isEqualTo(SettlementOutcome.CHARGE_REJECTED);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("1.98");

        // last month's round-ups stay unsettled while the new month starts from zero
        clock.set(firstMonth.plusMonths(1).withDayOfMonth(1).atTime(9, 0));
        ingest(connection, plaidPurchase(connection, "9.50"));
        BigDecimal beforeAttempt = reload(config).getCurrentMonthTotal();
        assertThat(beforeAttempt).isEqualByComparingTo("0.50");

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.ACCEPT);
        Donation donation = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).donation();
        assertThat(donation.getBaseAmount()).isEqualByComparingTo("2.48");
        assertThat(donation.getDeductedAmount()).isEqualByComparingTo("0.50");
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);

        assertThat(confirm(donation, PaymentEventType.CHARGE_FAILED, "Your card was declined."))
                .isEqualTo(ReconciliationOutcome.APPLIED);

        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(beforeAttempt);
        assertThat(roundUpTransactionRepository.findUnsettled(config.getId())).hasSize(3);
    }

    @Test
    @DisplayName("Revocation during an accepted charge freezes the config whatever the processor answers")
    void revocationWhileChargeInFlight() throws Exception {
        BankConnection failing = linkPlaidAccount();
        RoundUpConfig failingConfig = setupRoundUps(failing, null);
        ingest(failing, plaidPurchase(failing, "4.01"), plaidPurchase(failing, "7.01"));
        Donation failingDonation = settlementService
                .triggerSettlement(failingConfig.getId(), SettlementTrigger.MANUAL).donation();
        assertThat(failingDonation.getStatus()).isEqualTo(DonationStatus.PROCESSING);

        bankConnectionService.revokeConsent(failing.getUserId(), failing.getId());

        assertThatThrownBy(() -> settlementService.triggerSettlement(failingConfig.getId(), SettlementTrigger.MANUAL))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> ingest(failing, plaidPurchase(failing, "2.50")))
                .isInstanceOf(InvalidStateException.class);

        assertThat(confirm(failingDonation, PaymentEventType.CHARGE_FAILED, "Your card was declined."))
                .isEqualTo(ReconciliationOutcome.APPLIED);

        assertThat(donationRepository.findById(failingDonation.getId()).orElseThrow().getStatus())
                .isEqualTo(DonationStatus.FAILED);
        assertThat(roundUpTransactionRepository.findByRoundUpConfigIdOrderByCreatedAtAsc(failingConfig.getId()))
                .hasSize(2)
                .allMatch(entry -> entry.getStatus() == RoundUpTransactionStatus.FAILED);
        RoundUpConfig frozen = reload(failingConfig);
        assertThat(frozen.getStatus()).isEqualTo(RoundUpStatus.CANCELLED);
        assertThat(frozen.getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);

        BankConnection succeeding = linkPlaidAccount();
        RoundUpConfig succeedingConfig = setupRoundUps(succeeding, null);
        ingest(succeeding, plaidPurchase(succeeding, "4.01"), plaidPurchase(succeeding, "7.01"));
        Donation succeedingDonation = settlementService
                .triggerSettlement(succeedingConfig.getId(), SettlementTrigger.MANUAL).donation();

        bankConnectionService.revokeConsent(succeeding.getUserId(), succeeding.getId());

        assertThat(confirm(succeedingDonation, PaymentEventType.CHARGE_SUCCEEDED, null))
                .isEqualTo(ReconciliationOutcome.APPLIED);

        assertThat(donationRepository.findById(succeedingDonation.getId()).orElseThrow().getStatus())
                .isEqualTo(DonationStatus.COMPLETED);
        assertThat(roundUpTransactionRepository.findByDonationId(succeedingDonation.getId()))
                .hasSize(2)
                .allMatch(entry -> entry.getStatus() == RoundUpTransactionStatus.DONATED);
        assertThat(reload(succeedingConfig).getStatus()).isEqualTo(RoundUpStatus.CANCELLED);
    }

    @Test
    @DisplayName("Declined or rejected charges fail without deducting anything")
    void synchronousRejection() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.DECLINE);
        SettlementResult declined = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(declined.outcome()).isEqualTo(SettlementOutcome.CHARGE_REJECTED);
        assertThat(declined.donation().getStatus()).isEqualTo(DonationStatus.FAILED);
        assertThat(declined.donation().getFailureReason()).contains("Your card was declined.");
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("1.98");
        assertThat(reload(config).getStatus()).isEqualTo(RoundUpStatus.FAILED);
        assertMonthTotalMatchesLedger(config);

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.REJECT);
        SettlementResult rejected = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(rejected.outcome()).isEqualTo(SettlementOutcome.CHARGE_REJECTED);
        assertThat(rejected.donation().getFailureReason()).contains("No such payment method");
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("1.98");

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.ACCEPT);
        SettlementResult accepted = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(accepted.outcome()).isEqualTo(SettlementOutcome.CHARGE_REQUESTED);
        assertThat(accepted.donation().getIdempotencyKey()).endsWith("_3");
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("A timed-out charge stays PENDING and is released by recovery when no charge exists")
    void timeoutReleasedByRecovery() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.TIMEOUT);
        SettlementResult unknown = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);

        assertThat(unknown.outcome()).isEqualTo(SettlementOutcome.OUTCOME_UNKNOWN);
        assertThat(unknown.donation().getStatus()).isEqualTo(DonationStatus.PENDING);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("1.98");
        assertMonthTotalMatchesLedger(config);

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.ACCEPT);
        SettlementResult blocked = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);
        assertThat(blocked.outcome()).isEqualTo(SettlementOutcome.DUPLICATE);

        settlementService.recoverStalePendingDonations();
        assertThat(donationRepository.findById(unknown.donation().getId()).orElseThrow().getStatus())
                .isEqualTo(DonationStatus.PENDING);

        clock.advance(Duration.ofMinutes(16));
        settlementService.recoverStalePendingDonations();

        Donation released = donationRepository.findById(unknown.donation().getId()).orElseThrow();
        assertThat(released.getStatus()).isEqualTo(DonationStatus.FAILED);
        assertThat(roundUpTransactionRepository.findUnsettled(config.getId())).hasSize(2);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("1.98");
        assertMonthTotalMatchesLedger(config);
    }

    @Test
    @DisplayName("Recovery completes a PENDING donation whose charge went through")
    void timeoutCompletedByRecovery() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"));

        paymentProcessor.setMode(FakePaymentProcessorClient.Mode.TIMEOUT);
        Donation pending = settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).donation();
        paymentProcessor.putCharge(pending.getId().toString(), new ChargeResult("pi_recovered", ChargeStatus.SUCCEEDED, null));

        clock.advance(Duration.ofMinutes(16));
        settlementService.recoverStalePendingDonations();

        Donation completed = donationRepository.findById(pending.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(DonationStatus.COMPLETED);
        assertThat(completed.getProcessorChargeId()).isEqualTo("pi_recovered");
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertMonthTotalMatchesLedger(config);
    }

    @Test
    @DisplayName("Nothing is settled below the minimum amount or without round-ups")
    void nothingToSettle() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);

        assertThat(settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).outcome())
                .isEqualTo(SettlementOutcome.NOTHING_TO_SETTLE);

        ingest(connection, plaidPurchase(connection, "4.60"));
        assertThat(settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL).outcome())
                .isEqualTo(SettlementOutcome.NOTHING_TO_SETTLE);
        assertThat(paymentProcessor.getRequests()).isEmpty();
        assertThat(donationRepository.findFirstByRoundUpConfigIdAndStatusIn(config.getId(),
                List.of(DonationStatus.values()))).isEmpty();
    }

    @Test
    @DisplayName("A destination that is no longer verified blocks settlement but not accumulation")
    void unverifiedDestination() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, "3.00");
        causeDirectory.addCause(config.getOrganizationId(), config.getCauseId(), "SUSPENDED");

        IngestionSummary summary = ingest(connection,
                plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"),
                plaidPurchase(connection, "2.01"), plaidPurchase(connection, "5.50"));

        assertThat(summary.getAccepted()).isEqualTo(4);
        assertThat(summary.getSettlementsTriggered()).isZero();
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("3.47");
        assertThatThrownBy(() -> settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessageContaining("not verified");
        assertThat(paymentProcessor.getRequests()).isEmpty();
    }

    @Test
    @DisplayName("Month-start sweep settles enabled configs and resets every monthly total")
    void monthlySweep() throws Exception {
        clock.set(LocalDate.now(clock).withDayOfMonth(15).atTime(10, 0));
        BankConnection activeConnection = linkPlaidAccount();
        RoundUpConfig active = setupRoundUps(activeConnection, null);
        ingest(activeConnection, plaidPurchase(activeConnection, "4.01"), plaidPurchase(activeConnection, "7.01"));

        BankConnection pausedConnection = linkPlaidAccount();
        RoundUpConfig paused = setupRoundUps(pausedConnection, null);
        ingest(pausedConnection, plaidPurchase(pausedConnection, "2.01"), plaidPurchase(pausedConnection, "5.50"));
        roundUpConfigService.pauseRoundUps(paused.getId());

        LocalDate nextMonth = LocalDate.now(clock).withDayOfMonth(1).plusMonths(1);
        clock.set(nextMonth.atStartOfDay());
        settlementService.runMonthlySweep();

        Donation donation = singleDonation(active);
        assertThat(donation.getTrigger()).isEqualTo(SettlementTrigger.SCHEDULED);
        assertThat(donation.getBaseAmount()).isEqualByComparingTo("1.98");
        assertThat(donation.getSettlementPeriod()).isEqualTo(nextMonth.format(DateTimeFormatter.ofPattern("yyyy-MM")));

        RoundUpConfig reloadedActive = reload(active);
        assertThat(reloadedActive.getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(reloadedActive.getCurrentPeriodStart()).isEqualTo(nextMonth);

        RoundUpConfig reloadedPaused = reload(paused);
        assertThat(reloadedPaused.getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(reloadedPaused.getCurrentPeriodStart()).isEqualTo(nextMonth);
        assertThat(roundUpTransactionRepository.findUnsettled(paused.getId())).hasSize(2);
        assertThat(reloadedPaused.getTotalAccumulated()).isEqualByComparingTo("1.49");
    }

    private ReconciliationOutcome confirm(Donation donation, PaymentEventType type, String failureReason) {
        return paymentReconciliationService.handlePaymentWebhook(PaymentEvent.builder()
                .type(type)
                .rawType(type == PaymentEventType.CHARGE_SUCCEEDED
                        ? "payment_intent.succeeded"
                        : "payment_intent.payment_failed")
                .eventId(uniqueId("evt"))
                .donationId(donation.getId().toString())
                .chargeId(donation.getProcessorChargeId())
                .failureReason(failureReason)
                .build());
    }

    private Donation singleDonation(RoundUpConfig config) {
        List<Donation> donations = settlementService.getDonationHistory(config.getId(), 0, 10).getContent();
        assertThat(donations).hasSize(1);
        return donations.get(0);
    }

    private void assertMonthTotalMatchesLedger(RoundUpConfig config) {
        BigDecimal unsettled = roundUpTransactionRepository.sumRoundUpAmount(
                config.getId(), RoundUpTransactionStatus.PROCESSED);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(unsettled);
    }
}
