package com.nosota.roundup.client.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nosota.roundup.error.ProcessorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Stripe PaymentIntents client.
 *
 * <p>Charges are created confirmed and off-session against the donor's saved payment method.
 * Transport errors, 409, 429 and 5xx answers are retried with the same {@code Idempotency-Key}, so a retry
 * can never create a second charge. When retries are exhausted or the call times out the outcome
 * is reported as unknown.
 *
 * <p>Configuration:
 * <pre>
 * clients:
 *   stripe:
 *     enabled: true
 *     base-url: https://api.stripe.com
 *     secret-key: sk_...
 *     timeout: PT15S
 * </pre>
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "clients.stripe.enabled", havingValue = "true", matchIfMissing = true)
public class StripePaymentProcessorClient implements PaymentProcessorClient {

    private static final int MAX_RETRIES = 2;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private final WebClient webClient;
    private final Duration timeout;

    public StripePaymentProcessorClient(WebClient.Builder webClientBuilder,
                                        @Value("${clients.stripe.base-url}") String baseUrl,
                                        @Value("${clients.stripe.secret-key}") String secretKey,
                                        @Value("${clients.stripe.timeout:PT15S}") Duration timeout) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + secretKey)
                .build();
        this.timeout = timeout;
    }

    @Override
    public ChargeResult createCharge(ChargeRequest request) throws ProcessorException {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", String.valueOf(toMinorUnits(request.amount())));
        form.add("currency", request.currency().toLowerCase(Locale.ROOT));
        form.add("payment_method", request.paymentMethodId());
        form.add("confirm", "true");
        form.add("off_session", "true");
        if (request.description() != null) {
            form.add("description", request.description());
        }
        if (request.destinationAccount() != null) {
            form.add("transfer_data[destination]", request.destinationAccount());
            form.add("transfer_data[amount]", String.valueOf(toMinorUnits(request.transferAmount())));
        }
        if (request.metadata() != null) {
            request.metadata().forEach((key, value) -> form.add("metadata[" + key + "]", value));
        }

        log.info("Requesting Stripe charge: amount={} {}, idempotencyKey={}",
                request.amount(), request.currency(), request.idempotencyKey());

        PaymentIntent intent;
        try {
            intent = webClient.post()
                    .uri("/v1/payment_intents")
                    .header("Idempotency-Key", request.idempotencyKey())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(PaymentIntent.class)
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(MAX_RETRIES, RETRY_BACKOFF).filter(this::isRetryable))
                    .block();
        } catch (WebClientResponseException e) {
            if (isOutcomeUnknown(e.getStatusCode())) {
                throw new ProcessorException("Stripe charge outcome unknown: HTTP " + e.getStatusCode().value(), true, e);
            }
            // Card declines come back as 402 with the PaymentIntent in error.payment_intent
            throw new ProcessorException(extractErrorMessage(e), false, e);
        } catch (RuntimeException e) {
            throw new ProcessorException("Stripe charge outcome unknown: " + describe(e), true, e);
        }

        if (intent == null) {
            throw new ProcessorException("Stripe returned an empty body", true);
        }
        ChargeResult result = toResult(intent);
        log.info("Stripe charge {} status {}", result.chargeId(), result.status());
        return result;
    }

    @Override
    public Optional<ChargeResult> findChargeByDonationId(String donationId) throws ProcessorException {
        String query = "metadata['donationId']:'" + donationId + "'";
        SearchResponse response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/v1/payment_intents/search")
                            .queryParam("query", "{query}")
                            .build(query))
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new ProcessorException("Stripe search failed: " + describe(e), true, e);
        }

        if (response == null || response.data() == null || response.data().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toResult(response.data().get(0)));
    }

    // ==================== Private Helper Methods ====================

    static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    static ChargeResult toResult(PaymentIntent intent) {
        String failure = intent.lastPaymentError() != null ? intent.lastPaymentError().message() : null;
        return new ChargeResult(intent.id(), mapStatus(intent.status()), failure);
    }

    static ChargeStatus mapStatus(String status) {
        if (status == null) {
            return ChargeStatus.PROCESSING;
        }
        return switch (status) {
            case "succeeded" -> ChargeStatus.SUCCEEDED;
            case "requires_action", "requires_confirmation" -> ChargeStatus.REQUIRES_ACTION;
            case "requires_payment_method", "canceled" -> ChargeStatus.FAILED;
            default -> ChargeStatus.PROCESSING;
        };
    }

    /**
     * Statuses after which the charge may still exist or be created by a request already in flight.
     * 409 is a concurrent request with the same idempotency key, 429 is rate limiting.
     */
    static boolean isOutcomeUnknown(HttpStatusCode status) {
        return status.is5xxServerError()
                || status.value() == HttpStatus.CONFLICT.value()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            return isOutcomeUnknown(responseException.getStatusCode());
        }
        return throwable instanceof WebClientRequestException;
    }

    private String extractErrorMessage(WebClientResponseException e) {
        try {
            ErrorEnvelope envelope = e.getResponseBodyAs(ErrorEnvelope.class);
            if (envelope != null && envelope.error() != null && envelope.error().message() != null) {
                return envelope.error().message();
            }
        } catch (RuntimeException parseFailure) {
            log.debug("Could not parse Stripe error body: {}", parseFailure.getMessage());
        }
        return "Stripe rejected the charge: HTTP " + e.getStatusCode().value();
    }

    private String describe(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeout;
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PaymentIntent(
            @JsonProperty("id") String id,
            @JsonProperty("status") String status,
            @JsonProperty("metadata") Map<String, String> metadata,
            @JsonProperty("last_payment_error") StripeError lastPaymentError) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StripeError(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorEnvelope(@JsonProperty("error") StripeError error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(@JsonProperty("data") List<PaymentIntent> data) {
    }
}
