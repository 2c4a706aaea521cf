package com.nosota.roundup.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.roundup.dto.ConnectionEvent;
import com.nosota.roundup.dto.PaymentEvent;
import com.nosota.roundup.dto.ReconciliationOutcome;
import com.nosota.roundup.dto.WebhookAck;
import com.nosota.roundup.service.ConnectionWebhookService;
import com.nosota.roundup.service.PaymentReconciliationService;
import com.nosota.roundup.webhook.WebhookEventMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Function;

/**
 * Receives provider webhooks.
 *
 * <p>Payloads are read leniently: unreadable bodies and unknown events are acknowledged with 200 so the
 * provider does not retry them. Only unexpected processing failures answer with an error status.
 *
 * <p>Signature verification is done upstream at the gateway.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookEventMapper webhookEventMapper;
    private final ConnectionWebhookService connectionWebhookService;
    private final PaymentReconciliationService paymentReconciliationService;
    private final ObjectMapper objectMapper;

    @PostMapping("/plaid")
    public ResponseEntity<WebhookAck> plaidWebhook(@RequestBody(required = false) String body) {
        return handleConnectionEvent("Plaid", body, webhookEventMapper::fromPlaid);
    }

    @PostMapping("/basiq")
    public ResponseEntity<WebhookAck> basiqWebhook(@RequestBody(required = false) String body) {
        return handleConnectionEvent("Basiq", body, webhookEventMapper::fromBasiq);
    }

    @PostMapping("/payments")
    public ResponseEntity<WebhookAck> paymentWebhook(@RequestBody(required = false) String body) {
        JsonNode payload = read("payment", body);
        if (payload == null) {
            return ResponseEntity.ok(new WebhookAck(null, ReconciliationOutcome.IGNORED.name()));
        }

        PaymentEvent event = webhookEventMapper.fromPayment(payload);
        ReconciliationOutcome outcome = paymentReconciliationService.handlePaymentWebhook(event);
        return ResponseEntity.ok(new WebhookAck(event.rawType(), outcome.name()));
    }

    // ==================== Private Helper Methods ====================

    private ResponseEntity<WebhookAck> handleConnectionEvent(String source, String body,
                                                             Function<JsonNode, ConnectionEvent> mapping) {
        JsonNode payload = read(source, body);
        if (payload == null) {
            return ResponseEntity.ok(new WebhookAck(null, "IGNORED"));
        }

        ConnectionEvent event = mapping.apply(payload);
        log.info("{} webhook {} mapped to {}", source, event.rawType(), event.type());
        int affected = connectionWebhookService.handleConnectionWebhook(event);
        return ResponseEntity.ok(new WebhookAck(event.rawType(), event.type() + ":" + affected));
    }

    private JsonNode read(String source, String body) {
        if (body == null || body.isBlank()) {
            log.warn("Empty {} webhook body ignored", source);
            return null;
        }
        try {
            JsonNode payload = objectMapper.readTree(body);
            if (payload == null || !payload.isObject()) {
                log.warn("{} webhook body is not a JSON object, ignored", source);
                return null;
            }
            return payload;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} webhook body ignored: {}", source, e.getOriginalMessage());
            return null;
        }
    }
}
