package com.nosota.roundup.tests;

import com.nosota.roundup.TestBase;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.api.model.SettlementTrigger;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.api.provider.PlaidTransaction;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent deliveries and triggers against the same config.
 */
@DisplayName("Concurrency Tests")
public class ConcurrencyTest extends TestBase {

    private static final int THREADS = 8;

    private ExecutorService executor;

    @BeforeEach
    void startExecutor() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void stopExecutor() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(30, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Concurrent settlement triggers create exactly one donation")
    void concurrentTriggers() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        ingest(connection, plaidPurchase(connection, "4.01"), plaidPurchase(connection, "7.01"),
                plaidPurchase(connection, "2.01"));

        List<CompletableFuture<SettlementResult>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SettlementOutcome> outcomes = futures.stream().map(future -> future.join().outcome()).toList();
        assertThat(outcomes).filteredOn(outcome -> outcome == SettlementOutcome.CHARGE_REQUESTED).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> outcome == SettlementOutcome.DUPLICATE).hasSize(THREADS - 1);
        assertThat(paymentProcessor.getRequests()).hasSize(1);
        assertThat(settlementService.getDonationHistory(config.getId(), 0, 20).getTotalElements()).isEqualTo(1);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Concurrent deliveries of one transaction produce a single round-up")
    void concurrentDuplicateDeliveries() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        PlaidTransaction purchase = plaidPurchase(connection, "4.60");

        List<IngestionSummary> summaries = ingestConcurrently(connection, List.of(purchase));

        assertThat(summaries.stream().mapToInt(IngestionSummary::getAccepted).sum()).isEqualTo(1);
        assertThat(summaries.stream().mapToInt(summary -> summary.getSkipped(SkipReason.DUPLICATE)).sum())
                .isEqualTo(THREADS - 1);
        assertThat(roundUpTransactionRepository.findByRoundUpConfigIdOrderByCreatedAtAsc(config.getId())).hasSize(1);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("0.40");
    }

    @Test
    @DisplayName("Concurrent batches of distinct transactions lose no round-up")
    void concurrentDistinctDeliveries() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);

        List<CompletableFuture<IngestionSummary>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            List<PlaidTransaction> batch = List.of(
                    plaidPurchase(connection, "4.60"),
                    plaidPurchase(connection, "1.75"));
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return ingestionService.ingestProviderTransactions(connection.getId(), new ArrayList<>(batch));
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        RoundUpConfig reloaded = reload(config);
        assertThat(reloaded.getCurrentMonthTotal()).isEqualByComparingTo(new BigDecimal("0.65").multiply(BigDecimal.valueOf(THREADS)));
        assertThat(reloaded.getCurrentMonthTotal()).isEqualByComparingTo(
                roundUpTransactionRepository.sumRoundUpAmount(config.getId(), RoundUpTransactionStatus.PROCESSED));
        assertThat(roundUpTransactionRepository.findByRoundUpConfigIdOrderByCreatedAtAsc(config.getId()))
                .hasSize(THREADS * 2);
    }

    private List<IngestionSummary> ingestConcurrently(BankConnection connection, List<PlaidTransaction> batch) {
        List<CompletableFuture<IngestionSummary>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return ingestionService.ingestProviderTransactions(connection.getId(), new ArrayList<>(batch));
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }
}
