package com.nosota.roundup.client.bank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.provider.BasiqAuthArtifact;
import com.nosota.roundup.api.provider.BasiqTransaction;
import com.nosota.roundup.api.provider.ProviderAuthArtifact;
import com.nosota.roundup.api.provider.ProviderTransaction;
import com.nosota.roundup.error.AggregatorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Basiq API client (API version 3.0).
 *
 * <p>Server tokens are requested with the API key and cached until shortly before they expire.
 * Transaction listing follows {@code links.next} until the last page.
 *
 * <p>Configuration:
 * <pre>
 * clients:
 *   basiq:
 *     enabled: true
 *     base-url: https://au-api.basiq.io
 *     api-key: ...
 *     timeout: PT20S
 * </pre>
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "clients.basiq.enabled", havingValue = "true", matchIfMissing = true)
public class BasiqAggregatorClient implements BankAggregatorClient {

    private static final String API_VERSION = "3.0";
    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofMinutes(1);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;
    private final AtomicReference<CachedToken> token = new AtomicReference<>();

    public BasiqAggregatorClient(WebClient.Builder webClientBuilder,
                                 @Value("${clients.basiq.base-url}") String baseUrl,
                                 @Value("${clients.basiq.api-key}") String apiKey,
                                 @Value("${clients.basiq.timeout:PT20S}") Duration timeout) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("basiq-version", API_VERSION)
                .build();
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public BankProvider provider() {
        return BankProvider.BASIQ;
    }

    @Override
    public LinkedItem exchange(ProviderAuthArtifact artifact) throws AggregatorException {
        if (!(artifact instanceof BasiqAuthArtifact basiqArtifact)) {
            throw new IllegalArgumentException("Expected a Basiq auth artifact, got " + artifact.provider());
        }
        log.debug("Verifying Basiq connection {} of user {}", basiqArtifact.connectionId(), basiqArtifact.userId());

        ConnectionPayload connection = get(
                "/users/" + basiqArtifact.userId() + "/connections/" + basiqArtifact.connectionId(),
                ConnectionPayload.class);
        if (connection.status() != null && !"active".equalsIgnoreCase(connection.status())) {
            throw new AggregatorException("Basiq connection " + connection.id() + " is " + connection.status());
        }
        String institutionName = connection.institution() != null ? connection.institution().name() : null;
        return new LinkedItem(basiqArtifact.connectionId(), basiqArtifact.userId(), institutionName);
    }

    @Override
    public List<ProviderAccount> listAccounts(String userId) throws AggregatorException {
        AccountsResponse response = get("/users/" + userId + "/accounts", AccountsResponse.class);

        List<ProviderAccount> accounts = new ArrayList<>();
        if (response.data() != null) {
            for (AccountPayload account : response.data()) {
                String type = account.accountClass() != null ? account.accountClass().type() : null;
                accounts.add(new ProviderAccount(account.id(), account.name(), type, account.accountNo(), null));
            }
        }
        return accounts;
    }

    @Override
    public List<ProviderTransaction> listTransactions(String userId, String accountRef, LocalDate sinceDate)
            throws AggregatorException {
        String filter = String.format("account.id.eq('%s'),transaction.postDate.gteq('%s')", accountRef, sinceDate);
        String bearer = bearerToken();

        List<ProviderTransaction> transactions = new ArrayList<>();
        TransactionsResponse page = call("list transactions", webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/users/{userId}/transactions")
                        .queryParam("filter", "{filter}")
                        .build(userId, filter))
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .retrieve()
                .bodyToMono(TransactionsResponse.class));

        while (page != null) {
            if (page.data() != null) {
                transactions.addAll(page.data());
            }
            String next = page.links() != null ? page.links().next() : null;
            if (next == null || next.isBlank()) {
                break;
            }
            page = call("list transactions", webClient.get()
                    .uri(URI.create(next))
                    .header(HttpHeaders.AUTHORIZATION, bearer)
                    .retrieve()
                    .bodyToMono(TransactionsResponse.class));
        }

        log.debug("Fetched {} Basiq transactions for account {} since {}", transactions.size(), accountRef, sinceDate);
        return transactions;
    }

    @Override
    public void removeConsent(String userId, String connectionId) throws AggregatorException {
        log.info("Deleting Basiq connection {} of user {}", connectionId, userId);
        String bearer = bearerToken();
        call("delete connection", webClient.delete()
                .uri("/users/{userId}/connections/{connectionId}", userId, connectionId)
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .retrieve()
                .toBodilessEntity());
    }

    // ==================== Private Helper Methods ====================

    private <T> T get(String path, Class<T> responseType) throws AggregatorException {
        String bearer = bearerToken();
        T response = call(path, webClient.get()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .retrieve()
                .bodyToMono(responseType));
        if (response == null) {
            throw new AggregatorException("Basiq " + path + " returned an empty body");
        }
        return response;
    }

    private String bearerToken() throws AggregatorException {
        CachedToken cached = token.get();
        if (cached != null && cached.expiresAt().isAfter(Instant.now().plus(TOKEN_REFRESH_MARGIN))) {
            return "Bearer " + cached.value();
        }

        TokenResponse response = call("token", webClient.post()
                .uri("/token")
                .header(HttpHeaders.AUTHORIZATION, "Basic " + apiKey)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("scope", "SERVER_ACCESS"))
                .retrieve()
                .bodyToMono(TokenResponse.class));
        if (response == null || response.accessToken() == null) {
            throw new AggregatorException("Basiq token endpoint returned no token");
        }

        CachedToken fresh = new CachedToken(response.accessToken(), Instant.now().plusSeconds(response.expiresIn()));
        token.set(fresh);
        return "Bearer " + fresh.value();
    }

    private <T> T call(String operation, Mono<T> request) throws AggregatorException {
        try {
            return request.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            throw new AggregatorException(String.format("Basiq %s failed: HTTP %d %s",
                    operation, e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (RuntimeException e) {
            throw new AggregatorException("Basiq " + operation + " failed: " + e.getMessage(), e);
        }
    }

    record CachedToken(String value, Instant expiresAt) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("expires_in") long expiresIn) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConnectionPayload(
            @JsonProperty("id") String id,
            @JsonProperty("status") String status,
            @JsonProperty("institution") InstitutionPayload institution) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InstitutionPayload(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountsResponse(@JsonProperty("data") List<AccountPayload> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountPayload(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("accountNo") String accountNo,
            @JsonProperty("class") AccountClass accountClass) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccountClass(@JsonProperty("type") String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TransactionsResponse(
            @JsonProperty("data") List<BasiqTransaction> data,
            @JsonProperty("links") Links links) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Links(@JsonProperty("next") String next) {
    }
}
