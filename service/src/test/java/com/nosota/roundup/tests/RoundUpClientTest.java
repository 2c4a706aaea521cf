package com.nosota.roundup.tests;

import com.nosota.roundup.TestBase;
import com.nosota.roundup.api.RoundUpClient;
import com.nosota.roundup.api.dto.PagedResponse;
import com.nosota.roundup.api.model.ConnectionStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SettlementOutcome;
import com.nosota.roundup.api.model.SkipReason;
import com.nosota.roundup.api.provider.PlaidAuthArtifact;
import com.nosota.roundup.api.request.CreateRoundUpConfigRequest;
import com.nosota.roundup.api.request.IngestTransactionsRequest;
import com.nosota.roundup.api.request.LinkBankAccountRequest;
import com.nosota.roundup.api.response.BankConnectionResponse;
import com.nosota.roundup.api.response.DonationResponse;
import com.nosota.roundup.api.response.IngestionResponse;
import com.nosota.roundup.api.response.RoundUpConfigResponse;
import com.nosota.roundup.api.response.RoundUpTransactionResponse;
import com.nosota.roundup.api.response.SettlementResponse;
import com.nosota.roundup.model.BankConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives the running service through the consumer-side {@link RoundUpClient}.
 */
@DisplayName("Round-Up Client Tests")
public class RoundUpClientTest extends TestBase {

    @LocalServerPort
    private int port;

    private RoundUpClient client;

    @BeforeEach
    void createClient() {
        client = new RoundUpClient(WebClient.builder().baseUrl("http://localhost:" + port).build());
    }

    @Test
    @DisplayName("Link, configure, ingest and settle over HTTP")
    void fullCycle() {
        long userId = nextId();
        String accountId = uniqueId("acc");
        plaid().addAccount(accountId);

        BankConnectionResponse connection = client.linkBankAccount(new LinkBankAccountRequest(
                userId, new PlaidAuthArtifact(uniqueId("public"), accountId))).getBody();
        assertThat(connection).isNotNull();
        assertThat(connection.status()).isEqualTo(ConnectionStatus.ACTIVE);

        long organizationId = nextId();
        long causeId = nextId();
        causeDirectory.addVerifiedCause(organizationId, causeId);
        RoundUpConfigResponse config = client.createRoundUpConfig(new CreateRoundUpConfigRequest(
                userId, connection.id(), organizationId, causeId, null, "pm_card_visa", false, null)).getBody();
        assertThat(config).isNotNull();
        assertThat(config.status()).isEqualTo(RoundUpStatus.PENDING);

        BankConnection entity = bankConnectionRepository.findById(connection.id()).orElseThrow();
        IngestionResponse ingestion = client.ingestTransactions(connection.id(), new IngestTransactionsRequest(List.of(
                plaidPurchase(entity, "4.01"),
                plaidPurchase(entity, "7.01"),
                plaidPurchase(entity, "-12.00")))).getBody();
        assertThat(ingestion).isNotNull();
        assertThat(ingestion.accepted()).isEqualTo(2);
        assertThat(ingestion.roundUpTotal()).isEqualByComparingTo("1.98");
        assertThat(ingestion.skipped()).containsEntry(SkipReason.CREDIT, 1);

        SettlementResponse settlement = client.triggerSettlement(config.id()).getBody();
        assertThat(settlement).isNotNull();
        assertThat(settlement.outcome()).isEqualTo(SettlementOutcome.CHARGE_REQUESTED);
        assertThat(settlement.donation().baseAmount()).isEqualByComparingTo("1.98");

        PagedResponse<RoundUpTransactionResponse> settling = client.getRoundUpTransactions(
                config.id(), RoundUpTransactionStatus.PROCESSING, 0, 10).getBody();
        assertThat(settling).isNotNull();
        assertThat(settling.totalRecords()).isEqualTo(2);
        RoundUpTransactionResponse first = settling.data().get(0);
        assertThat(client.getRoundUpTransaction(first.id()).getBody().donationId())
                .isEqualTo(settlement.donation().id());
        assertThat(client.getRoundUpTransactions(config.id(), RoundUpTransactionStatus.PROCESSED, 0, 10)
                .getBody().totalRecords()).isZero();

        PagedResponse<DonationResponse> history = client.getDonationHistory(config.id(), 0, 10).getBody();
        assertThat(history).isNotNull();
        assertThat(history.totalRecords()).isEqualTo(1);
        assertThat(client.getDonation(settlement.donation().id()).getBody().id())
                .isEqualTo(settlement.donation().id());

        assertThat(client.listRoundUpConfigs(userId).getBody()).extracting(RoundUpConfigResponse::id)
                .containsExactly(config.id());
        assertThat(client.getRoundUpSummary(config.id()).getBody().totalAccumulated()).isEqualByComparingTo("1.98");
    }

    @Test
    @DisplayName("Error statuses surface as WebClient exceptions")
    void errorStatuses() {
        assertThatThrownBy(() -> client.getRoundUpConfig(UUID.randomUUID()))
                .isInstanceOfSatisfying(WebClientResponseException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));

        BankConnection connection;
        try {
            connection = linkPlaidAccount();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        assertThatThrownBy(() -> client.revokeConsent(connection.getId(), connection.getUserId() + 1))
                .isInstanceOfSatisfying(WebClientResponseException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));

        assertThat(client.revokeConsent(connection.getId(), connection.getUserId()).getBody().status())
                .isEqualTo(ConnectionStatus.REVOKED);
    }
}
