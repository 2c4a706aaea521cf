package com.nosota.roundup.service;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.ConnectionStatus;
import com.nosota.roundup.api.provider.ProviderAuthArtifact;
import com.nosota.roundup.client.bank.BankAggregatorClient;
import com.nosota.roundup.client.bank.BankAggregatorRegistry;
import com.nosota.roundup.client.bank.LinkedItem;
import com.nosota.roundup.client.bank.ProviderAccount;
import com.nosota.roundup.error.AggregatorException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.repository.BankConnectionRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for linking bank accounts and withdrawing consent.
 *
 * <p>Aggregator calls are made outside any database transaction; the uniqueness of
 * {@code active_account_key} settles concurrent links of the same account.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BankConnectionService {

    private final BankConnectionRepository bankConnectionRepository;
    private final BankAggregatorRegistry aggregatorRegistry;
    private final ConnectionLifecycleService lifecycleService;
    private final Clock clock;

    /**
     * Links the account selected in a provider consent flow.
     *
     * <p>Workflow:
     * <ol>
     *   <li>Exchange the auth artifact for a durable provider handle</li>
     *   <li>Check the selected account is visible through the consent</li>
     *   <li>Return the existing active connection for (user, provider, account), or create one</li>
     * </ol>
     *
     * @param userId   Owning user
     * @param artifact Provider consent result
     * @return The active connection
     * @throws ValidationFailedException if the provider rejects the artifact or the account is not part of the consent
     */
    public BankConnection linkBankAccount(@NotNull Long userId, @NotNull ProviderAuthArtifact artifact)
            throws ValidationFailedException {
        BankProvider provider = artifact.provider();
        String activeKey = BankConnection.activeAccountKey(userId, provider, artifact.accountId());

        Optional<BankConnection> existing = bankConnectionRepository.findByActiveAccountKey(activeKey);
        if (existing.isPresent()) {
            log.info("Account {} of user {} already linked as connection {}",
                    artifact.accountId(), userId, existing.get().getId());
            return existing.get();
        }

        BankAggregatorClient client = aggregatorRegistry.get(provider);
        LinkedItem item;
        ProviderAccount account;
        try {
            item = client.exchange(artifact);
            account = findAccount(client.listAccounts(item.providerUserRef()), artifact.accountId());
        } catch (AggregatorException e) {
            log.warn("{} rejected link for user {}: {}", provider, userId, e.getMessage());
            throw new ValidationFailedException("Bank link could not be verified: " + e.getMessage(), e);
        }
        if (account == null) {
            throw new ValidationFailedException(String.format(
                    "Account %s is not part of the %s consent", artifact.accountId(), provider));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BankConnection connection = new BankConnection();
        connection.setUserId(userId);
        connection.setProvider(provider);
        connection.setProviderConnectionId(item.providerConnectionId());
        connection.setProviderAccountId(account.accountId());
        connection.setProviderUserRef(item.providerUserRef());
        connection.setInstitutionName(item.institutionName() != null ? item.institutionName() : account.institutionName());
        connection.setAccountName(account.name());
        connection.setStatus(ConnectionStatus.ACTIVE);
        connection.setActive(true);
        connection.setActiveAccountKey(activeKey);
        connection.setCreatedAt(now);
        connection.setUpdatedAt(now);

        try {
            BankConnection saved = bankConnectionRepository.saveAndFlush(connection);
            log.info("Linked {} account {} for user {} as connection {}",
                    provider, account.accountId(), userId, saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent link of the same account
            return bankConnectionRepository.findByActiveAccountKey(activeKey).orElseThrow(() -> e);
        }
    }

    public BankConnection getBankConnection(@NotNull UUID connectionId) throws NotFoundException {
        return bankConnectionRepository.findById(connectionId)
                .orElseThrow(() -> new NotFoundException("Bank connection not found: " + connectionId));
    }

    /**
     * Withdraws the user's consent.
     *
     * <p>The consent is removed at the provider only when no other active connection shares the same
     * provider login. A provider failure is logged and does not block the local revocation.
     *
     * @return The revoked connection
     * @throws NotFoundException if the connection does not exist or belongs to another user
     */
    public BankConnection revokeConsent(@NotNull Long userId, @NotNull UUID connectionId) throws NotFoundException {
        BankConnection connection = getBankConnection(connectionId);
        if (!connection.getUserId().equals(userId)) {
            throw new NotFoundException("Bank connection not found: " + connectionId);
        }

        if (connection.isActive() || connection.getStatus() == ConnectionStatus.ERROR) {
            long sharing = bankConnectionRepository.countByProviderAndProviderConnectionIdAndActiveTrue(
                    connection.getProvider(), connection.getProviderConnectionId());
            boolean otherActive = sharing - (connection.isActive() ? 1 : 0) > 0;
            if (!otherActive) {
                try {
                    aggregatorRegistry.get(connection.getProvider())
                            .removeConsent(connection.getProviderUserRef(), connection.getProviderConnectionId());
                } catch (AggregatorException | IllegalStateException e) {
                    log.warn("Could not remove {} consent {} at the provider: {}",
                            connection.getProvider(), connection.getProviderConnectionId(), e.getMessage());
                }
            }
        }

        lifecycleService.terminate(connectionId, ConnectionStatus.REVOKED, "Consent revoked by user");
        return getBankConnection(connectionId);
    }

    // ==================== Private Helper Methods ====================

    private ProviderAccount findAccount(List<ProviderAccount> accounts, String accountId) {
        return accounts.stream()
                .filter(account -> accountId.equals(account.accountId()))
                .findFirst()
                .orElse(null);
    }
}
