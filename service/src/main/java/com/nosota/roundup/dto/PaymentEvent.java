package com.nosota.roundup.dto;

import lombok.Builder;

/**
 * Normalized payment processor confirmation.
 *
 * @param type          Event type
 * @param rawType       Processor event name, for logging
 * @param eventId       Processor event id
 * @param donationId    Donation id from the charge metadata, as sent
 * @param chargeId      Processor charge reference
 * @param failureReason Processor failure message, for failed charges
 */
@Builder
public record PaymentEvent(
        PaymentEventType type,
        String rawType,
        String eventId,
        String donationId,
        String chargeId,
        String failureReason
) {
}
