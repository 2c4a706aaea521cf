package com.nosota.roundup.client.bank;

/**
 * Bank account visible through a consent.
 *
 * @param accountId       Provider account id
 * @param name            Display name
 * @param type            Provider account type (depository, credit, transaction, ...)
 * @param mask            Last digits of the account number
 * @param institutionName Bank name
 */
public record ProviderAccount(String accountId, String name, String type, String mask, String institutionName) {
}
