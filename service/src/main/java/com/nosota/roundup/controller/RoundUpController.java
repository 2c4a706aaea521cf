package com.nosota.roundup.controller;

import com.nosota.roundup.api.RoundUpApi;
import com.nosota.roundup.api.dto.PagedResponse;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.api.model.SettlementTrigger;
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
import com.nosota.roundup.dto.IngestionSummary;
import com.nosota.roundup.dto.SettlementResult;
import com.nosota.roundup.error.CooldownActiveException;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ValidationFailedException;
import com.nosota.roundup.mapper.RoundUpMapper;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.Donation;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.model.RoundUpTransaction;
import com.nosota.roundup.service.BankConnectionService;
import com.nosota.roundup.service.CharitySwitchService;
import com.nosota.roundup.service.RoundUpConfigService;
import com.nosota.roundup.service.RoundUpIngestionService;
import com.nosota.roundup.service.RoundUpLedgerService;
import com.nosota.roundup.service.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for the round-up pipeline.
 *
 * <p>Implements {@link RoundUpApi}: bank connections, round-up configurations, ingestion, round-up history
 * and settlement.
 * Domain exceptions are translated by {@link com.nosota.roundup.exception.GlobalExceptionHandler}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class RoundUpController implements RoundUpApi {

    private final BankConnectionService bankConnectionService;
    private final RoundUpConfigService roundUpConfigService;
    private final RoundUpIngestionService ingestionService;
    private final SettlementService settlementService;
    private final CharitySwitchService charitySwitchService;
    private final RoundUpLedgerService ledgerService;

    // ==================== Bank Connections ====================

    @Override
    public ResponseEntity<BankConnectionResponse> linkBankAccount(LinkBankAccountRequest request)
            throws ValidationFailedException {
        log.info("Linking {} account {} for user {}",
                request.artifact().provider(), request.artifact().accountId(), request.userId());

        BankConnection connection = bankConnectionService.linkBankAccount(request.userId(), request.artifact());

        return ResponseEntity.status(HttpStatus.CREATED).body(RoundUpMapper.INSTANCE.toResponse(connection));
    }

    @Override
    public ResponseEntity<BankConnectionResponse> getBankConnection(UUID connectionId) throws NotFoundException {
        BankConnection connection = bankConnectionService.getBankConnection(connectionId);
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(connection));
    }

    @Override
    public ResponseEntity<BankConnectionResponse> revokeConsent(UUID connectionId, Long userId)
            throws NotFoundException {
        log.info("User {} revokes consent of connection {}", userId, connectionId);

        BankConnection connection = bankConnectionService.revokeConsent(userId, connectionId);

        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(connection));
    }

    @Override
    public ResponseEntity<IngestionResponse> ingestTransactions(UUID connectionId, IngestTransactionsRequest request)
            throws NotFoundException, InvalidStateException {
        IngestionSummary summary = ingestionService.ingestProviderTransactions(connectionId, request.transactions());

        IngestionResponse response = new IngestionResponse(
                summary.getBankConnectionId(),
                summary.getReceived(),
                summary.getAccepted(),
                summary.getRoundUpTotal(),
                Map.copyOf(summary.getSkipped()),
                summary.getSettlementsTriggered()
        );
        return ResponseEntity.ok(response);
    }

    // ==================== Round-Up Configurations ====================

    @Override
    public ResponseEntity<RoundUpConfigResponse> createRoundUpConfig(CreateRoundUpConfigRequest request)
            throws NotFoundException, InvalidStateException, ValidationFailedException {
        log.info("Creating round-up config: userId={}, connectionId={}, organizationId={}, causeId={}",
                request.userId(), request.bankConnectionId(), request.organizationId(), request.causeId());

        RoundUpConfig config = roundUpConfigService.createRoundUpConfig(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(RoundUpMapper.INSTANCE.toResponse(config));
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> getRoundUpConfig(UUID configId) throws NotFoundException {
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(roundUpConfigService.getRoundUpConfig(configId)));
    }

    @Override
    public ResponseEntity<List<RoundUpConfigResponse>> listRoundUpConfigs(Long userId) {
        List<RoundUpConfig> configs = roundUpConfigService.listRoundUpConfigs(userId);
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toConfigResponses(configs));
    }

    @Override
    public ResponseEntity<RoundUpSummaryResponse> getRoundUpSummary(UUID configId) throws NotFoundException {
        return ResponseEntity.ok(roundUpConfigService.getRoundUpSummary(configId));
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> pauseRoundUps(UUID configId)
            throws NotFoundException, InvalidStateException {
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(roundUpConfigService.pauseRoundUps(configId)));
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> resumeRoundUps(UUID configId)
            throws NotFoundException, InvalidStateException {
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(roundUpConfigService.resumeRoundUps(configId)));
    }

    @Override
    public ResponseEntity<RoundUpConfigResponse> switchCharity(UUID configId, SwitchCharityRequest request)
            throws NotFoundException, InvalidStateException, ValidationFailedException, CooldownActiveException {
        log.info("Switching charity of config {} to organization {} cause {}",
                configId, request.organizationId(), request.causeId());

        RoundUpConfig config = charitySwitchService.switchCharity(configId, request.organizationId(), request.causeId());

        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(config));
    }

    // ==================== Round-Ups ====================

    @Override
    public ResponseEntity<PagedResponse<RoundUpTransactionResponse>> getRoundUpTransactions(
            UUID configId, RoundUpTransactionStatus status, int page, int size) throws NotFoundException {
        Page<RoundUpTransaction> transactions = ledgerService.getRoundUpTransactions(configId, status, page, size);

        PagedResponse<RoundUpTransactionResponse> response = PagedResponse.of(
                RoundUpMapper.INSTANCE.toTransactionResponses(transactions.getContent()),
                page,
                size,
                transactions.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<RoundUpTransactionResponse> getRoundUpTransaction(UUID transactionId)
            throws NotFoundException {
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(ledgerService.getRoundUpTransaction(transactionId)));
    }

    // ==================== Settlement ====================

    @Override
    public ResponseEntity<SettlementResponse> triggerSettlement(UUID configId)
            throws NotFoundException, InvalidStateException, ValidationFailedException {
        log.info("Manual settlement requested for config {}", configId);

        SettlementResult result = settlementService.triggerSettlement(configId, SettlementTrigger.MANUAL);

        DonationResponse donation = result.donation() != null
                ? RoundUpMapper.INSTANCE.toResponse(result.donation())
                : null;
        return ResponseEntity.ok(new SettlementResponse(result.roundUpConfigId(), result.outcome(), donation));
    }

    @Override
    public ResponseEntity<PagedResponse<DonationResponse>> getDonationHistory(UUID configId, int page, int size) {
        Page<Donation> donations = settlementService.getDonationHistory(configId, page, size);

        PagedResponse<DonationResponse> response = PagedResponse.of(
                RoundUpMapper.INSTANCE.toDonationResponses(donations.getContent()),
                page,
                size,
                donations.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<DonationResponse> getDonation(UUID donationId) throws NotFoundException {
        return ResponseEntity.ok(RoundUpMapper.INSTANCE.toResponse(settlementService.getDonation(donationId)));
    }
}
