package com.nosota.roundup.service;

import com.nosota.roundup.api.model.ConnectionStatus;
import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.model.RoundUpConfig;
import com.nosota.roundup.notification.ConnectionTerminatedEvent;
import com.nosota.roundup.repository.BankConnectionRepository;
import com.nosota.roundup.repository.RoundUpConfigRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies connection state transitions.
 *
 * <p>Lock order is config first, then connection; ingestion and settlement take the config lock
 * before reading the connection, so once a termination commits they observe the new state.
 *
 * <p>Transitions:
 * <ul>
 *   <li>terminate (REVOKED/EXPIRED): connection deactivated, active config cancelled and disabled,
 *       accumulated amounts left as they are, user notified</li>
 *   <li>error (ERROR): connection deactivated with the provider error code, config left untouched</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionLifecycleService {

    private final BankConnectionRepository bankConnectionRepository;
    private final RoundUpConfigRepository roundUpConfigRepository;
    private final ConnectionStatusStateMachine stateMachine;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Moves a connection to REVOKED or EXPIRED and cancels its active config.
     *
     * @param connectionId Connection to terminate
     * @param targetStatus REVOKED or EXPIRED
     * @param reason       Human-readable reason, stored on connection and config
     * @return true if the connection changed, false if it was already final (duplicate event)
     */
    @Transactional
    public boolean terminate(UUID connectionId, ConnectionStatus targetStatus, String reason) {
        if (!stateMachine.isFinalState(targetStatus)) {
            throw new IllegalArgumentException("Not a terminal connection status: " + targetStatus);
        }

        RoundUpConfig config = lockActiveConfig(connectionId);
        BankConnection connection = bankConnectionRepository.getOneForUpdate(connectionId);
        if (connection == null) {
            log.warn("Cannot terminate connection {}: not found", connectionId);
            return false;
        }
        if (stateMachine.isFinalState(connection.getStatus())) {
            log.info("Connection {} already {}, ignoring duplicate {} transition",
                    connectionId, connection.getStatus(), targetStatus);
            return false;
        }
        stateMachine.validateTransition(connection.getStatus(), targetStatus);

        LocalDateTime now = LocalDateTime.now(clock);
        ConnectionStatus previous = connection.getStatus();
        deactivate(connection, targetStatus, reason, now);
        bankConnectionRepository.save(connection);

        UUID configId = null;
        if (config != null) {
            configId = config.getId();
            config.setStatus(RoundUpStatus.CANCELLED);
            config.setEnabled(false);
            config.setActiveConnectionId(null);
            config.setLastFailureReason(reason);
            config.setCancelledAt(now);
            config.setUpdatedAt(now);
            roundUpConfigRepository.save(config);
        }

        log.info("Connection {} {} -> {} ({}), config {} cancelled",
                connectionId, previous, targetStatus, reason, configId);

        eventPublisher.publishEvent(new ConnectionTerminatedEvent(
                connection.getUserId(), connectionId, targetStatus, configId, reason));
        return true;
    }

    /**
     * Moves an ACTIVE connection to ERROR. The config is kept so a later revocation still cancels it.
     *
     * @return true if the connection changed
     */
    @Transactional
    public boolean markError(UUID connectionId, String errorCode, String errorMessage) {
        lockActiveConfig(connectionId);
        BankConnection connection = bankConnectionRepository.getOneForUpdate(connectionId);
        if (connection == null) {
            log.warn("Cannot mark connection {} as failed: not found", connectionId);
            return false;
        }
        if (!stateMachine.isTransitionAllowed(connection.getStatus(), ConnectionStatus.ERROR)
                || connection.getStatus() == ConnectionStatus.ERROR) {
            log.info("Connection {} is {}, ignoring error event {}", connectionId, connection.getStatus(), errorCode);
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String reason = errorMessage != null ? errorMessage : "Bank login needs attention";
        deactivate(connection, ConnectionStatus.ERROR, reason, now);
        connection.setErrorCode(errorCode);
        bankConnectionRepository.save(connection);

        log.warn("Connection {} ACTIVE -> ERROR (code={}): {}", connectionId, errorCode, reason);

        eventPublisher.publishEvent(new ConnectionTerminatedEvent(
                connection.getUserId(), connectionId, ConnectionStatus.ERROR, null, reason));
        return true;
    }

    // ==================== Private Helper Methods ====================

    private RoundUpConfig lockActiveConfig(UUID connectionId) {
        Optional<UUID> configId = roundUpConfigRepository.findActiveConfigId(connectionId);
        return configId.map(roundUpConfigRepository::getOneForUpdate).orElse(null);
    }

    private void deactivate(BankConnection connection, ConnectionStatus status, String reason, LocalDateTime now) {
        connection.setStatus(status);
        connection.setActive(false);
        connection.setActiveAccountKey(null);
        connection.setErrorMessage(reason);
        connection.setDeactivatedAt(now);
        connection.setUpdatedAt(now);
    }
}
