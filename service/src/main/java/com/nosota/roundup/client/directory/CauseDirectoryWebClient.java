package com.nosota.roundup.client.directory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * WebClient implementation of {@link CauseDirectoryClient}.
 *
 * <p>A 404 from the directory means the cause or organization does not exist and is returned as empty;
 * any other failure propagates.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "clients.cause-directory.enabled", havingValue = "true", matchIfMissing = true)
public class CauseDirectoryWebClient implements CauseDirectoryClient {

    private final WebClient webClient;
    private final Duration timeout;

    public CauseDirectoryWebClient(WebClient.Builder webClientBuilder,
                                   @Value("${clients.cause-directory.base-url}") String baseUrl,
                                   @Value("${clients.cause-directory.timeout:PT5S}") Duration timeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.timeout = timeout;
    }

    @Override
    public Optional<CauseInfo> getCause(Long causeId) {
        return webClient.get()
                .uri("/api/v1/causes/{id}", causeId)
                .retrieve()
                .bodyToMono(CauseInfo.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("Cause {} not found in directory", causeId);
                    return Mono.empty();
                })
                .timeout(timeout)
                .blockOptional();
    }

    @Override
    public Optional<OrganizationPayoutStatus> getOrganizationPayoutStatus(Long organizationId) {
        return webClient.get()
                .uri("/api/v1/organizations/{id}/payout-status", organizationId)
                .retrieve()
                .bodyToMono(OrganizationPayoutStatus.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("Organization {} not found in directory", organizationId);
                    return Mono.empty();
                })
                .timeout(timeout)
                .blockOptional();
    }
}
