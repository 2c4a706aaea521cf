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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the ledger against PostgreSQL, where row locks and unique indexes behave as in production.
 * Skipped when no Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Ledger Tests")
public class PostgresLedgerTest extends TestBase {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16.6").asCompatibleSubstituteFor("postgres"));

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Test
    @DisplayName("Accumulate and settle on PostgreSQL")
    void accumulateAndSettle() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, "3.00");

        IngestionSummary summary = ingest(connection,
                plaidPurchase(connection, "4.01"),
                plaidPurchase(connection, "7.01"),
                plaidPurchase(connection, "2.01"),
                plaidPurchase(connection, "5.50"));

        assertThat(summary.getSettlementsTriggered()).isEqualTo(1);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("0.00");
        assertThat(roundUpTransactionRepository.sumRoundUpAmount(config.getId(), RoundUpTransactionStatus.PROCESSING))
                .isEqualByComparingTo("3.47");
    }

    @Test
    @DisplayName("Row locks serialize concurrent deliveries and triggers")
    void concurrentWrites() throws Exception {
        BankConnection connection = linkPlaidAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        PlaidTransaction purchase = plaidPurchase(connection, "4.01");

        List<CompletableFuture<IngestionSummary>> deliveries = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            deliveries.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return ingestionService.ingestProviderTransactions(connection.getId(), List.of(purchase));
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }));
        }
        CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();

        assertThat(deliveries.stream().mapToInt(future -> future.join().getAccepted()).sum()).isEqualTo(1);
        assertThat(deliveries.stream().mapToInt(future -> future.join().getSkipped(SkipReason.DUPLICATE)).sum())
                .isEqualTo(5);

        ingest(connection, plaidPurchase(connection, "7.01"));

        List<CompletableFuture<SettlementResult>> triggers = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            triggers.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return settlementService.triggerSettlement(config.getId(), SettlementTrigger.MANUAL);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }));
        }
        CompletableFuture.allOf(triggers.toArray(new CompletableFuture[0])).join();

        assertThat(triggers.stream().map(future -> future.join().outcome()))
                .filteredOn(outcome -> outcome == SettlementOutcome.CHARGE_REQUESTED)
                .hasSize(1);
        assertThat(paymentProcessor.getRequests()).hasSize(1);
    }
}
