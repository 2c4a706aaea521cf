package com.nosota.roundup.api;

import com.nosota.roundup.api.dto.PagedResponse;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.request.CreateRoundUpConfigRequest;
import com.nosota.roundup.api.request.IngestTransactionsRequest;
import com.nosota.roundup.api.request.LinkBankAccountRequest;
import com.nosota.roundup.api.request.SwitchCharityRequest;
import com.nosota.roundup.api.response.BankConnectionResponse;
import com.nosota.roundup.api.response.DonationResponse;
import com.nosota.roundup.api.response.IngestionResponse;
import com.nosota.roundup.api.response.RoundUpConfigResponse;
import com.nosota.roundup.api.response.RoundUpSummaryResponse;
import com.nosota.roundup.api.response.RoundUpTransactionResponse;
import com.nosota.roundup.api.response.SettlementResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of RoundUpApi for consuming the round-up service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class RoundUpClientConfig {
 *     @Bean
 *     public RoundUpClient roundUpClient(WebClient.Builder builder,
 *                                        @Value("${services.roundup.url}") String baseUrl) {
 *         return new RoundUpClient(builder.baseUrl(baseUrl).build());
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class RoundUpClient implements RoundUpApi {

    private final WebClient webClient;

    // ==================== Bank Connections ====================

    @Override
    public ResponseEntity<BankConnectionResponse> linkBankAccount(LinkBankAccountRequest request) {
        log.debug("Calling linkBankAccount: userId={}, provider={}",
                request.userId(), request.artifact().provider());

        return webClient.post()
                .uri("/api/v1/roundup/connections")
                .bodyValue(request)
                .retrieve()
                .toEntity(BankConnectionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BankConnectionResponse> getBankConnection(UUID connectionId) {
        log.debug("Calling getBankConnection: connectionId={}", connectionId);

        return webClient.get()
                .uri("/api/v1/roundup/connections/{connectionId}", connectionId)
                .retrieve()
                .toEntity(BankConnectionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BankConnectionResponse> revokeConsent(UUID connectionId, Long userId) {
        log.debug("Calling revokeConsent: connectionId={}, userId={}", connectionId, userId);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/roundup/connections/{connectionId}/revoke")
                        .queryParam("userId", userId)
                        .build(connectionId))
                .retrieve()
                .toEntity(BankConnectionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IngestionResponse> ingestTransactions(UUID connectionId, IngestTransactionsRequest request) {
        log.debug("Calling ingestTransactions: connectionId={}, count={}",
                connectionId, request.transactions().size());

        return webClient.post()
                .uri("/api/v1/roundup/connections/{connectionId}/transactions", connectionId)
                .bodyValue(request)
                .retrieve()
                .toEntity(IngestionResponse.class)
                .block();
    }

    // ==================== Round-Up Configurations ====================

    @Override
    public ResponseEntity<RoundUpConfigResponse> createRoundUpConfig(CreateRoundUpConfigRequest request) {
        log.debug("Calling createRoundUpConfig: userId={}, bankConnectionId={}, causeId={}",
                request.userId(), request.bankConnectionId(), request.causeId());

        return webClient.post()
                .uri("/api/v1/roundup/configs")
                .bodyValue(request)
                .retrieve()
                .toEntity(RoundUpConfigResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> getRoundUpConfig(UUID configId) {
        log.debug("Calling getRoundUpConfig: configId={}", configId);

        return webClient.get()
                .uri("/api/v1/roundup/configs/{configId}", configId)
                .retrieve()
                .toEntity(RoundUpConfigResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<RoundUpConfigResponse>> listRoundUpConfigs(Long userId) {
        log.debug("Calling listRoundUpConfigs: userId={}", userId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/roundup/configs")
                        .queryParam("userId", userId)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<RoundUpConfigResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<RoundUpSummaryResponse> getRoundUpSummary(UUID configId) {
        log.debug("Calling getRoundUpSummary: configId={}", configId);

        return webClient.get()
                .uri("/api/v1/roundup/configs/{configId}/summary", configId)
                .retrieve()
                .toEntity(RoundUpSummaryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> pauseRoundUps(UUID configId) {
        log.debug("Calling pauseRoundUps: configId={}", configId);

        return webClient.post()
                .uri("/api/v1/roundup/configs/{configId}/pause", configId)
                .retrieve()
                .toEntity(RoundUpConfigResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> resumeRoundUps(UUID configId) {
        log.debug("Calling resumeRoundUps: configId={}", configId);

        return webClient.post()
                .uri("/api/v1/roundup/configs/{configId}/resume", configId)
                .retrieve()
                .toEntity(RoundUpConfigResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> switchCharity(UUID configId, SwitchCharityRequest request) {
        log.debug("Calling switchCharity: configId={}, organizationId={}, causeId={}",
                configId, request.organizationId(), request.causeId());

        return webClient.post()
                .uri("/api/v1/roundup/configs/{configId}/charity", configId)
                .bodyValue(request)
                .retrieve()
                .toEntity(RoundUpConfigResponse.class)
                .block();
    }

    // ==================== Round-Ups ====================

    @Override
    public ResponseEntity<PagedResponse<RoundUpTransactionResponse>> getRoundUpTransactions(
            UUID configId, RoundUpTransactionStatus status, int page, int size) {
        log.debug("Calling getRoundUpTransactions: configId={}, status={}, page={}, size={}",
                configId, status, page, size);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/roundup/configs/{configId}/transactions")
                            .queryParam("page", page)
                            .queryParam("size", size);
                    if (status != null) {
                        uriBuilder.queryParam("status", status);
                    }
                    return uriBuilder.build(configId);
                })
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<RoundUpTransactionResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<RoundUpTransactionResponse> getRoundUpTransaction(UUID transactionId) {
        log.debug("Calling getRoundUpTransaction: transactionId={}", transactionId);

        return webClient.get()
                .uri("/api/v1/roundup/transactions/{transactionId}", transactionId)
                .retrieve()
                .toEntity(RoundUpTransactionResponse.class)
                .block();
    }

    // ==================== Settlement ====================

    @Override
    public ResponseEntity<SettlementResponse> triggerSettlement(UUID configId) {
        log.debug("Calling triggerSettlement: configId={}", configId);

        return webClient.post()
                .uri("/api/v1/roundup/configs/{configId}/settlement", configId)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<DonationResponse>> getDonationHistory(UUID configId, int page, int size) {
        log.debug("Calling getDonationHistory: configId={}, page={}, size={}", configId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/roundup/configs/{configId}/donations")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(configId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<DonationResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<DonationResponse> getDonation(UUID donationId) {
        log.debug("Calling getDonation: donationId={}", donationId);

        return webClient.get()
                .uri("/api/v1/roundup/donations/{donationId}", donationId)
                .retrieve()
                .toEntity(DonationResponse.class)
                .block();
    }
}
