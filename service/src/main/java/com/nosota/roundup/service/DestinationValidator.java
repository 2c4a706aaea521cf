package com.nosota.roundup.service;

import com.nosota.roundup.client.directory.CauseDirectoryClient;
import com.nosota.roundup.client.directory.CauseInfo;
import com.nosota.roundup.client.directory.OrganizationPayoutStatus;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks that a cause can receive donations through its organization.
 *
 * <p>The cause must exist, belong to the organization and be VERIFIED; the organization
 * must have a receivable payout account.
 */
@Component
@RequiredArgsConstructor
public class DestinationValidator {

    private final CauseDirectoryClient causeDirectoryClient;

    /**
     * @return Payout status of the organization
     * @throws NotFoundException         if the cause or organization does not exist
     * @throws ValidationFailedException if the cause is foreign or unverified, or the organization cannot receive funds
     */
    public OrganizationPayoutStatus validate(Long organizationId, Long causeId)
            throws NotFoundException, ValidationFailedException {
        CauseInfo cause = causeDirectoryClient.getCause(causeId)
                .orElseThrow(() -> new NotFoundException("Cause not found: " + causeId));
        if (!organizationId.equals(cause.organizationId())) {
            throw new ValidationFailedException(String.format(
                    "Cause %d does not belong to organization %d", causeId, organizationId));
        }
        if (!cause.isVerified()) {
            throw new ValidationFailedException("Cause " + causeId + " is not verified (" + cause.status() + ")");
        }

        OrganizationPayoutStatus payout = causeDirectoryClient.getOrganizationPayoutStatus(organizationId)
                .orElseThrow(() -> new NotFoundException("Organization not found: " + organizationId));
        if (!payout.receivable()) {
            throw new ValidationFailedException("Organization " + organizationId + " has no active payout account");
        }
        return payout;
    }

    /**
     * Same checks, with a missing cause or organization reported as {@link ValidationFailedException}.
     * Used at setup and settlement, where the destination is a stored choice rather than a lookup.
     */
    public OrganizationPayoutStatus revalidate(Long organizationId, Long causeId) throws ValidationFailedException {
        try {
            return validate(organizationId, causeId);
        } catch (NotFoundException e) {
            throw new ValidationFailedException(e.getMessage(), e);
        }
    }
}
