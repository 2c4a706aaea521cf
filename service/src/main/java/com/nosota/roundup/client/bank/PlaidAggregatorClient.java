package com.nosota.roundup.client.bank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.provider.PlaidAuthArtifact;
import com.nosota.roundup.api.provider.PlaidTransaction;
import com.nosota.roundup.api.provider.ProviderAuthArtifact;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.error.AggregatorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plaid API client.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code /item/public_token/exchange} - public token → access token + item id</li>
 *   <li>{@code /accounts/get} - accounts of an item</li>
 *   <li>{@code /transactions/get} - transactions, paged by offset</li>
 *   <li>{@code /item/remove} - consent withdrawal</li>
 * </ul>
 *
 * <p>Configuration:
 * <pre>
 * clients:
 *   plaid:
 *     enabled: true
 *     base-url: https://sandbox.plaid.com
 *     client-id: ...
 *     secret: ...
 *     timeout: PT20S
 * </pre>
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "clients.plaid.enabled", havingValue = "true", matchIfMissing = true)
public class PlaidAggregatorClient implements BankAggregatorClient {

    private static final int PAGE_SIZE = 500;

    private final WebClient webClient;
    private final String clientId;
    private final String secret;
    private final Duration timeout;

    public PlaidAggregatorClient(WebClient.Builder webClientBuilder,
                                 @Value("${clients.plaid.base-url}") String baseUrl,
                                 @Value("${clients.plaid.client-id}") String clientId,
                                 @Value("${clients.plaid.secret}") String secret,
                                 @Value("${clients.plaid.timeout:PT20S}") Duration timeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.clientId = clientId;
        this.secret = secret;
        this.timeout = timeout;
    }

    @Override
    public BankProvider provider() {
        return BankProvider.PLAID;
    }

    @Override
    public LinkedItem exchange(ProviderAuthArtifact artifact) throws AggregatorException {
        if (!(artifact instanceof PlaidAuthArtifact plaidArtifact)) {
            throw new IllegalArgumentException("Expected a Plaid auth artifact, got " + artifact.provider());
        }
        log.debug("Exchanging Plaid public token");

        ExchangeResponse response = post("/item/public_token/exchange",
                Map.of("public_token", plaidArtifact.publicToken()), ExchangeResponse.class);
        return new LinkedItem(response.itemId(), response.accessToken(), null);
    }

    @Override
    public List<ProviderAccount> listAccounts(String accessToken) throws AggregatorException {
        AccountsResponse response = post("/accounts/get",
                Map.of("access_token", accessToken), AccountsResponse.class);

        String institutionName = response.item() != null ? response.item().institutionName() : null;
        List<ProviderAccount> accounts = new ArrayList<>();
        if (response.accounts() != null) {
            for (AccountPayload account : response.accounts()) {
                accounts.add(new ProviderAccount(account.accountId(), account.name(), account.type(),
                        account.mask(), institutionName));
            }
        }
        return accounts;
    }

    @Override
    public List<ProviderTransaction> listTransactions(String accessToken, String accountRef, LocalDate sinceDate)
            throws AggregatorException {
        List<ProviderTransaction> transactions = new ArrayList<>();
        int total;
        do {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("access_token", accessToken);
            body.put("start_date", sinceDate.toString());
            body.put("end_date", LocalDate.now().toString());
            body.put("options", Map.of(
                    "account_ids", List.of(accountRef),
                    "count", PAGE_SIZE,
                    "offset", transactions.size()));

            TransactionsResponse page = post("/transactions/get", body, TransactionsResponse.class);
            total = page.totalTransactions();
            if (page.transactions() == null || page.transactions().isEmpty()) {
                break;
            }
            transactions.addAll(page.transactions());
        } while (transactions.size() < total);

        log.debug("Fetched {} Plaid transactions for account {} since {}", transactions.size(), accountRef, sinceDate);
        return transactions;
    }

    @Override
    public void removeConsent(String accessToken, String itemId) throws AggregatorException {
        log.info("Removing Plaid item {}", itemId);
        post("/item/remove", Map.of("access_token", accessToken), Map.class);
    }

    // ==================== Private Helper Methods ====================

    private <T> T post(String path, Map<String, Object> body, Class<T> responseType) throws AggregatorException {
        Map<String, Object> authenticated = new LinkedHashMap<>(body);
        authenticated.put("client_id", clientId);
        authenticated.put("secret", secret);

        try {
            T response = webClient.post()
                    .uri(path)
                    .bodyValue(authenticated)
                    .retrieve()
                    .bodyToMono(responseType)
                    .timeout(timeout)
                    .block();
            if (response == null) {
                throw new AggregatorException("Plaid " + path + " returned an empty body");
            }
            return response;
        } catch (WebClientResponseException e) {
            throw new AggregatorException(String.format("Plaid %s failed: HTTP %d %s",
                    path, e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (RuntimeException e) {
            throw new AggregatorException("Plaid " + path + " failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExchangeResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("item_id") String itemId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountsResponse(
            @JsonProperty("accounts") List<AccountPayload> accounts,
            @JsonProperty("item") ItemPayload item) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountPayload(
            @JsonProperty("account_id") String accountId,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("mask") String mask) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ItemPayload(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("institution_name") String institutionName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TransactionsResponse(
            @JsonProperty("transactions") List<PlaidTransaction> transactions,
            @JsonProperty("total_transactions") int totalTransactions) {
    }
}
