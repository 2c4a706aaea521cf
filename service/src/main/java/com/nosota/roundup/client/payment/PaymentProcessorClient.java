package com.nosota.roundup.client.payment;

import com.nosota.roundup.error.ProcessorException;

import java.util.Optional;

/**
 * Payment processor charging donors' stored payment methods.
 */
public interface PaymentProcessorClient {

    /**
     * Requests a charge.
     *
     * <p>A returned result with status {@link ChargeStatus#FAILED} or a {@link ProcessorException} with
     * {@code outcomeUnknown == false} is a definitive rejection. A {@link ProcessorException} with
     * {@code outcomeUnknown == true} means the charge may exist and must not be requested again blindly.
     */
    ChargeResult createCharge(ChargeRequest request) throws ProcessorException;

    /**
     * Looks up the charge created for a donation, using the {@code donationId} metadata tag.
     *
     * @return The charge, or empty when the processor has none
     */
    Optional<ChargeResult> findChargeByDonationId(String donationId) throws ProcessorException;
}
