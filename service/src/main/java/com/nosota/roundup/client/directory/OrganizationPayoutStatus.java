package com.nosota.roundup.client.directory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Payout readiness of an organization.
 *
 * @param organizationId     Organization id
 * @param receivable         Whether its payout account is active and can receive charges
 * @param connectedAccountId Payout account at the payment processor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrganizationPayoutStatus(Long organizationId, boolean receivable, String connectedAccountId) {
}
