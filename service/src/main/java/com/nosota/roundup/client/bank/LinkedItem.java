package com.nosota.roundup.client.bank;

/**
 * Durable handle obtained from a consent flow.
 *
 * @param providerConnectionId Plaid item id or Basiq connection id
 * @param providerUserRef      Plaid access token or Basiq user id
 * @param institutionName      Bank name, when known at this point
 */
public record LinkedItem(String providerConnectionId, String providerUserRef, String institutionName) {
}
