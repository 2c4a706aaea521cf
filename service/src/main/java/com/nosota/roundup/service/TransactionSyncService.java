package com.nosota.roundup.service;

import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.client.bank.BankAggregatorRegistry;
import com.nosota.roundup.config.AsyncConfig;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.error.AggregatorException;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pulls transactions from the aggregator and feeds them to ingestion.
 *
 * <p>Used by the periodic sync job and, asynchronously, by transactions-updated webhooks.
 * The window starts at the last sync date (ingestion drops what was already seen) or,
 * on the first sync, {@code roundup.sync.initial-lookback-days} back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionSyncService {

    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpConfigRepository roundUpConfigRepository;
    private final BankAggregatorRegistry aggregatorRegistry;
    private final RoundUpIngestionService ingestionService;
    private final Clock clock;

    @Value("${roundup.sync.initial-lookback-days:30}")
    private int initialLookbackDays;

    /**
     * Syncs one connection.
     *
     * @return Ingestion tally, or empty when the connection is not active or has no active config
     * @throws AggregatorException if the provider call fails
     */
    public Optional<IngestionSummary> syncConnection(UUID connectionId)
            throws AggregatorException, NotFoundException, InvalidStateException {
        BankConnection connection = bankConnectionRepository.findById(connectionId)
                .orElseThrow(() -> new NotFoundException("Bank connection not found: " + connectionId));
        if (!connection.isActive()) {
            log.debug("Connection {} is {}, sync skipped", connectionId, connection.getStatus());
            return Optional.empty();
        }
        Optional<RoundUpConfig> config = roundUpConfigRepository.findByActiveConnectionId(connectionId);
        if (config.isEmpty() || !config.get().isEnabled()) {
            log.debug("Connection {} has no active enabled round-up config, sync skipped", connectionId);
            return Optional.empty();
        }

        LocalDateTime startedAt = LocalDateTime.now(clock);
        LocalDate since = connection.getLastSyncedAt() != null
                ? connection.getLastSyncedAt().toLocalDate()
                : startedAt.toLocalDate().minusDays(initialLookbackDays);

        List<ProviderTransaction> transactions = aggregatorRegistry.get(connection.getProvider())
                .listTransactions(connection.getProviderUserRef(), connection.getProviderAccountId(), since);

        IngestionSummary summary = ingestionService.ingestProviderTransactions(connectionId, transactions);
        bankConnectionRepository.updateLastSyncedAt(connectionId, startedAt);

        log.info("Synced connection {} since {}: {} fetched, {} accepted",
                connectionId, since, summary.getReceived(), summary.getAccepted());
        return Optional.of(summary);
    }

    /**
     * Syncs every connection with an active, enabled config. A failing connection does not stop the run.
     *
     * @return Number of connections synced
     */
    public int syncActiveConnections() {
        List<UUID> connectionIds = roundUpConfigRepository.findSyncableConnectionIds();
        int synced = 0;
        for (UUID connectionId : connectionIds) {
            try {
                if (syncConnection(connectionId).isPresent()) {
                    synced++;
                }
            } catch (AggregatorException e) {
                log.warn("Sync of connection {} failed at the provider: {}", connectionId, e.getMessage());
            } catch (NotFoundException | InvalidStateException e) {
                log.info("Sync of connection {} not possible: {}", connectionId, e.getMessage());
            }
        }
        log.info("Synced {} of {} connection(s)", synced, connectionIds.size());
        return synced;
    }

    /**
     * Schedules a sync on the background executor; failures are logged.
     */
    @Async(AsyncConfig.SYNC_EXECUTOR)
    public void syncConnectionAsync(UUID connectionId) {
        try {
            syncConnection(connectionId);
        } catch (AggregatorException e) {
            log.warn("Sync of connection {} failed at the provider: {}", connectionId, e.getMessage());
        } catch (NotFoundException | InvalidStateException e) {
            log.info("Sync of connection {} not possible: {}", connectionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync of connection {} failed", connectionId, e);
        }
    }
}
