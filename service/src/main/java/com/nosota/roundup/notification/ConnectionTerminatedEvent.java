package com.nosota.roundup.notification;

import com.nosota.roundup.api.model.ConnectionStatus;

import java.util.UUID;

/**
 * Published when a bank connection leaves ACTIVE.
 *
 * @param userId          Owner to notify
 * @param connectionId    Affected connection
 * @param status          New connection status
 * @param roundUpConfigId Config cancelled along with the connection, null if none
 * @param reason          Human-readable reason
 */
public record ConnectionTerminatedEvent(
        Long userId,
        UUID connectionId,
        ConnectionStatus status,
        UUID roundUpConfigId,
        String reason
) {
}
