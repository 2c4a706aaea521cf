package com.nosota.roundup.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.dto.ConnectionEvent;
import com.nosota.roundup.dto.ConnectionEventType;
import com.nosota.roundup.dto.PaymentEvent;
import com.nosota.roundup.dto.PaymentEventType;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates provider webhook payloads into provider-neutral events.
 *
 * <p>Never throws for unknown or incomplete payloads: they map to {@code UNKNOWN} events, which the
 * handlers log and ignore.
 */
@Component
public class WebhookEventMapper {

    private static final Pattern BASIQ_CONNECTION_ENTITY = Pattern.compile("/users/([^/]+)/connections/([^/?#]+)");
    private static final Pattern BASIQ_ACCOUNT_ENTITY = Pattern.compile("/users/([^/]+)/accounts/([^/?#]+)");
    private static final Pattern BASIQ_USER_ENTITY = Pattern.compile("/users/([^/?#]+)");

    // ==================== Plaid ====================

    /**
     * Maps a Plaid webhook ({@code webhook_type}, {@code webhook_code}, {@code item_id}).
     */
    public ConnectionEvent fromPlaid(JsonNode payload) {
        String webhookType = text(payload, "webhook_type");
        String webhookCode = text(payload, "webhook_code");
        String rawType = webhookType + "." + webhookCode;

        ConnectionEvent.ConnectionEventBuilder event = ConnectionEvent.builder()
                .provider(BankProvider.PLAID)
                .rawType(rawType)
                .providerConnectionId(text(payload, "item_id"));

        JsonNode error = payload.path("error");
        if (error.isObject()) {
            event.errorCode(text(error, "error_code"));
            event.errorMessage(text(error, "error_message"));
        }

        if ("TRANSACTIONS".equals(webhookType)) {
            return event.type(plaidTransactionsType(webhookCode)).build();
        }
        if (!"ITEM".equals(webhookType) || webhookCode == null) {
            return event.type(ConnectionEventType.UNKNOWN).build();
        }

        switch (webhookCode) {
            case "ERROR" -> {
                String errorCode = text(error, "error_code");
                event.type("ITEM_LOGIN_REQUIRED".equals(errorCode)
                        ? ConnectionEventType.LOGIN_REQUIRED
                        : ConnectionEventType.ERROR);
                if (errorCode == null) {
                    event.errorCode(webhookCode);
                }
            }
            case "LOGIN_REQUIRED", "ITEM_LOGIN_REQUIRED" -> event.type(ConnectionEventType.LOGIN_REQUIRED)
                    .errorCode("ITEM_LOGIN_REQUIRED");
            case "USER_PERMISSION_REVOKED" -> event.type(ConnectionEventType.CONSENT_REVOKED);
            case "USER_ACCOUNT_REVOKED" -> event.type(ConnectionEventType.ACCOUNT_UPDATED)
                    .providerAccountId(text(payload, "account_id"))
                    .accountStatus("inactive");
            case "PENDING_EXPIRATION", "PENDING_DISCONNECT", "WEBHOOK_UPDATED", "LOGIN_REPAIRED" ->
                    event.type(ConnectionEventType.IGNORED);
            default -> event.type(ConnectionEventType.UNKNOWN);
        }
        return event.build();
    }

    // ==================== Basiq ====================

    /**
     * Maps a Basiq event ({@code eventTypeId}, {@code links.eventEntity}). Accepts the event itself or
     * the delivery envelope wrapping it in {@code body}.
     */
    public ConnectionEvent fromBasiq(JsonNode payload) {
        JsonNode event = payload.path("body").isObject() ? payload.path("body") : payload;
        String eventTypeId = text(event, "eventTypeId");
        String entity = text(event.path("links"), "eventEntity");

        ConnectionEvent.ConnectionEventBuilder builder = ConnectionEvent.builder()
                .provider(BankProvider.BASIQ)
                .rawType(eventTypeId)
                .type(basiqType(eventTypeId));

        if (entity != null) {
            Matcher connection = BASIQ_CONNECTION_ENTITY.matcher(entity);
            Matcher account = BASIQ_ACCOUNT_ENTITY.matcher(entity);
            Matcher user = BASIQ_USER_ENTITY.matcher(entity);
            if (connection.find()) {
                builder.providerUserRef(connection.group(1)).providerConnectionId(connection.group(2));
            } else if (account.find()) {
                builder.providerUserRef(account.group(1)).providerAccountId(account.group(2));
            } else if (user.find()) {
                builder.providerUserRef(user.group(1));
            }
        }

        JsonNode data = event.path("data");
        String status = text(data, "status");
        builder.accountStatus(status != null ? status : text(event, "status"));
        builder.errorCode(text(data, "code"));
        builder.errorMessage(text(data, "detail"));
        return builder.build();
    }

    // ==================== Payments ====================

    /**
     * Maps a Stripe event. The charge reference is the payment intent id, also for {@code charge.*} events.
     */
    public PaymentEvent fromPayment(JsonNode payload) {
        String type = text(payload, "type");
        JsonNode object = payload.path("data").path("object");

        String chargeId = text(object, "payment_intent");
        if (chargeId == null) {
            chargeId = text(object, "id");
        }
        String failureReason = text(object.path("last_payment_error"), "message");
        if (failureReason == null) {
            failureReason = text(object, "failure_message");
        }

        return PaymentEvent.builder()
                .type(paymentType(type))
                .rawType(type)
                .eventId(text(payload, "id"))
                .donationId(text(object.path("metadata"), "donationId"))
                .chargeId(chargeId)
                .failureReason(failureReason)
                .build();
    }

    // ==================== Private Helper Methods ====================

    private ConnectionEventType plaidTransactionsType(String webhookCode) {
        if (webhookCode == null) {
            return ConnectionEventType.UNKNOWN;
        }
        return switch (webhookCode) {
            case "SYNC_UPDATES_AVAILABLE", "DEFAULT_UPDATE", "INITIAL_UPDATE", "HISTORICAL_UPDATE" ->
                    ConnectionEventType.TRANSACTIONS_UPDATED;
            case "TRANSACTIONS_REMOVED", "RECURRING_TRANSACTIONS_UPDATE" -> ConnectionEventType.IGNORED;
            default -> ConnectionEventType.UNKNOWN;
        };
    }

    private ConnectionEventType basiqType(String eventTypeId) {
        if (eventTypeId == null) {
            return ConnectionEventType.UNKNOWN;
        }
        return switch (eventTypeId) {
            case "transactions.updated", "transaction.created" -> ConnectionEventType.TRANSACTIONS_UPDATED;
            case "connection.invalidated" -> ConnectionEventType.CONNECTION_INVALIDATED;
            case "consent.revoked" -> ConnectionEventType.CONSENT_REVOKED;
            case "consent.expired" -> ConnectionEventType.CONSENT_EXPIRED;
            case "account.updated" -> ConnectionEventType.ACCOUNT_UPDATED;
            case "user.deleted" -> ConnectionEventType.USER_DELETED;
            case "connection.created", "consent.created", "consent.updated", "user.created" ->
                    ConnectionEventType.IGNORED;
            default -> ConnectionEventType.UNKNOWN;
        };
    }

    private PaymentEventType paymentType(String type) {
        if (type == null) {
            return PaymentEventType.UNKNOWN;
        }
        return switch (type) {
            case "payment_intent.succeeded", "charge.succeeded" -> PaymentEventType.CHARGE_SUCCEEDED;
            case "payment_intent.payment_failed", "charge.failed" -> PaymentEventType.CHARGE_FAILED;
            default -> PaymentEventType.UNKNOWN;
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
