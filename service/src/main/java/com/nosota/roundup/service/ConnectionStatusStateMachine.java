package com.nosota.roundup.service;

import com.nosota.roundup.api.model.ConnectionStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating BankConnection status transitions.
 *
 * <p>State diagram:
 * <pre>
 *            ACTIVE
 *              |
 *     +--------+--------+
 *     |        |        |
 *   ERROR   REVOKED  EXPIRED
 *     |
 *     +--→ REVOKED / EXPIRED
 * </pre>
 *
 * <p>There is no way back to ACTIVE: recovery is a new consent flow that creates a new connection.
 */
@Component
public class ConnectionStatusStateMachine {

    private static final Map<ConnectionStatus, Set<ConnectionStatus>> ALLOWED_TRANSITIONS = Map.of(
            ConnectionStatus.ACTIVE, EnumSet.of(
                    ConnectionStatus.ERROR,
                    ConnectionStatus.REVOKED,
                    ConnectionStatus.EXPIRED
            ),
            // a broken login can still be revoked or expire
            ConnectionStatus.ERROR, EnumSet.of(
                    ConnectionStatus.REVOKED,
                    ConnectionStatus.EXPIRED
            )
    );

    public boolean isTransitionAllowed(ConnectionStatus fromStatus, ConnectionStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        if (fromStatus == toStatus) {
            return true;
        }
        Set<ConnectionStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(ConnectionStatus fromStatus, ConnectionStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid connection status transition: %s -> %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    /**
     * REVOKED and EXPIRED end the consent for good.
     */
    public boolean isFinalState(ConnectionStatus status) {
        return status == ConnectionStatus.REVOKED || status == ConnectionStatus.EXPIRED;
    }

    public boolean permitsIngestion(ConnectionStatus status) {
        return status == ConnectionStatus.ACTIVE;
    }
}
