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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Round-up API interface.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Bank connections (linking, consent revocation)</li>
 *   <li>Round-up configurations (setup, pause/resume, charity switch, summary)</li>
 *   <li>Transaction ingestion and round-up history</li>
 *   <li>Settlement and donation history</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>RoundUpController - in service module (server-side implementation)</li>
 *   <li>RoundUpClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/roundup")
public interface RoundUpApi {

    // ==================== Bank Connections ====================

    /**
     * Links a bank account after a successful provider consent flow.
     * Linking the same account again returns the existing active connection.
     *
     * @param request User and provider auth artifact
     * @return The active bank connection
     */
    @PostMapping("/connections")
    ResponseEntity<BankConnectionResponse> linkBankAccount(
            @Valid @RequestBody LinkBankAccountRequest request) throws Exception;

    @GetMapping("/connections/{connectionId}")
    ResponseEntity<BankConnectionResponse> getBankConnection(
            @PathVariable("connectionId") UUID connectionId) throws Exception;

    /**
     * Revokes the user's consent: removes it at the provider, deactivates the
     * connection and cancels its round-up configuration.
     *
     * @param connectionId Connection to revoke
     * @param userId       Owning user
     * @return The revoked connection
     */
    @PostMapping("/connections/{connectionId}/revoke")
    ResponseEntity<BankConnectionResponse> revokeConsent(
            @PathVariable("connectionId") UUID connectionId,
            @RequestParam("userId") Long userId) throws Exception;

    /**
     * Ingests provider transactions for a connection. Idempotent per provider transaction id.
     *
     * @param connectionId Connection the transactions belong to
     * @param request      Provider payloads
     * @return Accepted/skipped counts
     */
    @PostMapping("/connections/{connectionId}/transactions")
    ResponseEntity<IngestionResponse> ingestTransactions(
            @PathVariable("connectionId") UUID connectionId,
            @Valid @RequestBody IngestTransactionsRequest request) throws Exception;

    // ==================== Round-Up Configurations ====================

    @PostMapping("/configs")
    ResponseEntity<RoundUpConfigResponse> createRoundUpConfig(
            @Valid @RequestBody CreateRoundUpConfigRequest request) throws Exception;

    @GetMapping("/configs/{configId}")
    ResponseEntity<RoundUpConfigResponse> getRoundUpConfig(
            @PathVariable("configId") UUID configId) throws Exception;

    @GetMapping("/configs")
    ResponseEntity<List<RoundUpConfigResponse>> listRoundUpConfigs(
            @RequestParam("userId") Long userId);

    @GetMapping("/configs/{configId}/summary")
    ResponseEntity<RoundUpSummaryResponse> getRoundUpSummary(
            @PathVariable("configId") UUID configId) throws Exception;

    @PostMapping("/configs/{configId}/pause")
    ResponseEntity<RoundUpConfigResponse> pauseRoundUps(
            @PathVariable("configId") UUID configId) throws Exception;

    @PostMapping("/configs/{configId}/resume")
    ResponseEntity<RoundUpConfigResponse> resumeRoundUps(
            @PathVariable("configId") UUID configId) throws Exception;

    /**
     * Changes the donation destination, subject to the switch cooldown.
     *
     * @param configId Config to update
     * @param request  New organization and cause
     * @return Updated config
     */
    @PostMapping("/configs/{configId}/charity")
    ResponseEntity<RoundUpConfigResponse> switchCharity(
            @PathVariable("configId") UUID configId,
            @Valid @RequestBody SwitchCharityRequest request) throws Exception;

    // ==================== Round-Ups ====================

    /**
     * Lists a config's round-ups, newest first.
     *
     * @param configId Config the round-ups accumulated on
     * @param status   Optional status filter
     * @param page     Zero-based page
     * @param size     Page size
     * @return Page of round-ups
     */
    @GetMapping("/configs/{configId}/transactions")
    ResponseEntity<PagedResponse<RoundUpTransactionResponse>> getRoundUpTransactions(
            @PathVariable("configId") UUID configId,
            @RequestParam(value = "status", required = false) RoundUpTransactionStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) throws Exception;

    @GetMapping("/transactions/{transactionId}")
    ResponseEntity<RoundUpTransactionResponse> getRoundUpTransaction(
            @PathVariable("transactionId") UUID transactionId) throws Exception;

    // ==================== Settlement ====================

    /**
     * Settles the config's accumulated round-ups now. Idempotent while a settlement is in flight.
     *
     * @param configId Config to settle
     * @return Settlement outcome and the donation, if one was created
     */
    @PostMapping("/configs/{configId}/settlement")
    ResponseEntity<SettlementResponse> triggerSettlement(
            @PathVariable("configId") UUID configId) throws Exception;

    @GetMapping("/configs/{configId}/donations")
    ResponseEntity<PagedResponse<DonationResponse>> getDonationHistory(
            @PathVariable("configId") UUID configId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @GetMapping("/donations/{donationId}")
    ResponseEntity<DonationResponse> getDonation(
            @PathVariable("donationId") UUID donationId) throws Exception;
}
