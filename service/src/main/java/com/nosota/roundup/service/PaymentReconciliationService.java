package com.nosota.roundup.service;

import com.nosota.roundup.dto.PaymentEvent;
import com.nosota.roundup.dto.PaymentEventType;
import com.nosota.roundup.dto.ReconciliationOutcome;
import com.nosota.roundup.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Applies asynchronous payment processor confirmations to donations.
 *
 * <p>Unknown event types, events without a donation id and events for unknown donations are logged and
 * ignored. Re-delivered confirmations for a donation that already reached a final state are duplicates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReconciliationService {

    private final DonationRecordService donationRecordService;

    public ReconciliationOutcome handlePaymentWebhook(PaymentEvent event) {
        if (event.type() == null || event.type() == PaymentEventType.UNKNOWN) {
            log.debug("Ignoring payment event {} ({})", event.rawType(), event.eventId());
            return ReconciliationOutcome.IGNORED;
        }

        UUID donationId = parseDonationId(event.donationId());
        if (donationId == null) {
            log.info("Payment event {} ({}) carries no donation id, ignored", event.rawType(), event.eventId());
            return ReconciliationOutcome.IGNORED;
        }

        boolean succeeded = event.type() == PaymentEventType.CHARGE_SUCCEEDED;
        try {
            ReconciliationOutcome outcome = donationRecordService.applyConfirmation(
                    donationId, succeeded, event.chargeId(), event.failureReason());
            log.info("Payment event {} ({}) for donation {}: {}", event.rawType(), event.eventId(), donationId, outcome);
            return outcome;
        } catch (NotFoundException e) {
            log.warn("Payment event {} ({}) references unknown donation {}, ignored",
                    event.rawType(), event.eventId(), donationId);
            return ReconciliationOutcome.IGNORED;
        }
    }

    private UUID parseDonationId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Malformed donation id in payment metadata: {}", value);
            return null;
        }
    }
}
