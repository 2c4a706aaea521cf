package com.nosota.roundup.client.bank;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.provider.ProviderAuthArtifact;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.error.AggregatorException;

import java.time.LocalDate;
import java.util.List;

/**
 * Bank data aggregator, reached through its HTTP API.
 *
 * <p>One implementation per {@link BankProvider}; {@link BankAggregatorRegistry} picks the right one.
 */
public interface BankAggregatorClient {

    BankProvider provider();

    /**
     * Turns the client-side consent result into a durable handle.
     *
     * @param artifact Result of the consent flow
     * @return Provider connection id and the user reference data calls are made with
     */
    LinkedItem exchange(ProviderAuthArtifact artifact) throws AggregatorException;

    List<ProviderAccount> listAccounts(String userRef) throws AggregatorException;

    /**
     * Posted and pending transactions of one account since the given date (inclusive).
     */
    List<ProviderTransaction> listTransactions(String userRef, String accountRef, LocalDate sinceDate)
            throws AggregatorException;

    /**
     * Withdraws the consent at the provider.
     */
    void removeConsent(String userRef, String providerConnectionId) throws AggregatorException;
}
