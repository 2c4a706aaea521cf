package com.nosota.roundup.tests;

import com.nosota.roundup.TestBase;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.error.AggregatorException;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.service.TransactionSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for pulling transactions from the aggregators.
 */
@DisplayName("Transaction Sync Tests")
public class TransactionSyncTest extends TestBase {

    @Autowired
    private TransactionSyncService transactionSyncService;

    @Test
    @DisplayName("Sync ingests new transactions and records the sync time")
    void syncConnection() throws Exception {
        BankConnection connection = linkBasiqAccount();
        RoundUpConfig config = setupRoundUps(connection, null);
        basiq().addTransactions(connection.getProviderAccountId(), List.of(
                basiqPayment(connection, "-23.45"),
                basiqPayment(connection, "-9.99")));

        Optional<IngestionSummary> first = transactionSyncService.syncConnection(connection.getId());

        assertThat(first).isPresent();
        assertThat(first.get().getAccepted()).isEqualTo(2);
        assertThat(reload(connection).getLastSyncedAt()).isNotNull();
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("0.56");

        Optional<IngestionSummary> second = transactionSyncService.syncConnection(connection.getId());

        assertThat(second).isPresent();
        assertThat(second.get().getAccepted()).isZero();
        assertThat(second.get().getSkipped(SkipReason.DUPLICATE)).isEqualTo(2);
        assertThat(reload(config).getCurrentMonthTotal()).isEqualByComparingTo("0.56");
    }

    @Test
    @DisplayName("Connections without an enabled config are not synced")
    void skipsPausedAndUnconfigured() throws Exception {
        BankConnection unconfigured = linkPlaidAccount();
        BankConnection paused = linkPlaidAccount();
        RoundUpConfig pausedConfig = setupRoundUps(paused, null);
        roundUpConfigService.pauseRoundUps(pausedConfig.getId());

        assertThat(transactionSyncService.syncConnection(unconfigured.getId())).isEmpty();
        assertThat(transactionSyncService.syncConnection(paused.getId())).isEmpty();
        assertThat(plaid().getListTransactionsCalls()).isZero();
    }

    @Test
    @DisplayName("Periodic sync covers active configs and survives a failing provider")
    void syncActiveConnections() throws Exception {
        BankConnection plaidConnection = linkPlaidAccount();
        RoundUpConfig plaidConfig = setupRoundUps(plaidConnection, null);
        BankConnection basiqConnection = linkBasiqAccount();
        RoundUpConfig basiqConfig = setupRoundUps(basiqConnection, null);
        plaid().addTransactions(plaidConnection.getProviderAccountId(), List.of(plaidPurchase(plaidConnection, "4.60")));
        basiq().addTransactions(basiqConnection.getProviderAccountId(), List.of(basiqPayment(basiqConnection, "-9.99")));
        plaid().setFailing(true);

        transactionSyncService.syncActiveConnections();

        assertThat(reload(plaidConfig).getCurrentMonthTotal()).isEqualByComparingTo("0.00");
        assertThat(reload(plaidConnection).getLastSyncedAt()).isNull();
        assertThat(reload(basiqConfig).getCurrentMonthTotal()).isEqualByComparingTo("0.01");

        plaid().setFailing(false);
        transactionSyncService.syncActiveConnections();

        assertThat(reload(plaidConfig).getCurrentMonthTotal()).isEqualByComparingTo("0.40");
        assertThat(reload(basiqConfig).getCurrentMonthTotal()).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("A provider failure on a single sync is reported to the caller")
    void providerFailure() throws Exception {
        BankConnection connection = linkPlaidAccount();
        setupRoundUps(connection, null);
        plaid().setFailing(true);

        assertThatThrownBy(() -> transactionSyncService.syncConnection(connection.getId()))
                .isInstanceOf(AggregatorException.class);
        assertThat(reload(connection).getLastSyncedAt()).isNull();
    }
}
