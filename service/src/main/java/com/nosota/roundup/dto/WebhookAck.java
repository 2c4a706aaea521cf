package com.nosota.roundup.dto;

/**
 * Body returned to webhook senders. Webhooks are always acknowledged unless processing failed unexpectedly.
 *
 * @param event   Provider event name, null when the payload could not be read
 * @param outcome What the handler did with it
 */
public record WebhookAck(String event, String outcome) {
}
