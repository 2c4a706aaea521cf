package com.nosota.roundup.service;

import com.nosota.roundup.api.model.ConnectionStatus;
import com.nosota.roundup.dto.ConnectionEvent;
import com.nosota.roundup.model.BankConnection;
import com.nosota.roundup.repository.BankConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies normalized bank connection webhook events.
 *
 * <p>Event handling:
 * <ul>
 *   <li>TRANSACTIONS_UPDATED → background sync of each active matched connection</li>
 *   <li>CONNECTION_INVALIDATED, CONSENT_REVOKED, USER_DELETED → REVOKED, config cancelled</li>
 *   <li>CONSENT_EXPIRED → EXPIRED, config cancelled</li>
 *   <li>ACCOUNT_UPDATED with a closed account → REVOKED for that account only</li>
 *   <li>LOGIN_REQUIRED, ERROR → ERROR with the provider code</li>
 *   <li>anything else → logged and ignored</li>
 * </ul>
 *
 * <p>Handlers are idempotent: a repeated event finds the connection already in its target state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionWebhookService {

    private static final Set<String> CLOSED_ACCOUNT_STATUSES = Set.of("deleted", "inactive", "closed");

    private final BankConnectionRepository bankConnectionRepository;
    private final ConnectionLifecycleService lifecycleService;
    private final TransactionSyncService transactionSyncService;

    /**
     * @return Number of connections the event changed or scheduled a sync for
     */
    public int handleConnectionWebhook(ConnectionEvent event) {
        if (event.type() == null) {
            log.warn("Connection event without type ignored: {}", event);
            return 0;
        }

        return switch (event.type()) {
            case TRANSACTIONS_UPDATED -> scheduleSync(event);
            case CONNECTION_INVALIDATED -> terminate(event, ConnectionStatus.REVOKED, "Bank connection was invalidated by the provider");
            case CONSENT_REVOKED -> terminate(event, ConnectionStatus.REVOKED, "Bank access consent was revoked");
            case CONSENT_EXPIRED -> terminate(event, ConnectionStatus.EXPIRED, "Bank access consent expired");
            case USER_DELETED -> terminate(event, ConnectionStatus.REVOKED, "Bank user was deleted at the provider");
            case ACCOUNT_UPDATED -> handleAccountUpdated(event);
            case LOGIN_REQUIRED, ERROR -> markError(event);
            case IGNORED, UNKNOWN -> {
                log.info("{} connection event {} ignored", event.provider(), event.rawType());
                yield 0;
            }
        };
    }

    // ==================== Private Helper Methods ====================

    private int scheduleSync(ConnectionEvent event) {
        int scheduled = 0;
        for (BankConnection connection : matchConnections(event)) {
            if (connection.isActive()) {
                transactionSyncService.syncConnectionAsync(connection.getId());
                scheduled++;
            }
        }
        log.info("{} {}: sync scheduled for {} connection(s)", event.provider(), event.rawType(), scheduled);
        return scheduled;
    }

    private int terminate(ConnectionEvent event, ConnectionStatus status, String reason) {
        List<BankConnection> connections = matchConnections(event);
        if (connections.isEmpty()) {
            log.info("{} {}: no matching connection", event.provider(), event.rawType());
        }
        int changed = 0;
        for (BankConnection connection : connections) {
            if (lifecycleService.terminate(connection.getId(), status, reason)) {
                changed++;
            }
        }
        return changed;
    }

    private int handleAccountUpdated(ConnectionEvent event) {
        String status = event.accountStatus() != null ? event.accountStatus().toLowerCase(Locale.ROOT) : null;
        if (status == null || !CLOSED_ACCOUNT_STATUSES.contains(status)) {
            log.info("{} account {} updated to {}, no action", event.provider(), event.providerAccountId(), status);
            return 0;
        }
        return terminate(event, ConnectionStatus.REVOKED, "Bank account was " + status);
    }

    private int markError(ConnectionEvent event) {
        int changed = 0;
        for (BankConnection connection : matchConnections(event)) {
            if (lifecycleService.markError(connection.getId(), event.errorCode(), event.errorMessage())) {
                changed++;
            }
        }
        return changed;
    }

    private List<BankConnection> matchConnections(ConnectionEvent event) {
        List<BankConnection> candidates;
        if (event.providerConnectionId() != null) {
            candidates = bankConnectionRepository.findByProviderAndProviderConnectionId(
                    event.provider(), event.providerConnectionId());
        } else if (event.providerUserRef() != null) {
            candidates = bankConnectionRepository.findByProviderAndProviderUserRef(
                    event.provider(), event.providerUserRef());
        } else if (event.providerAccountId() != null) {
            candidates = bankConnectionRepository.findByProviderAndProviderAccountId(
                    event.provider(), event.providerAccountId());
        } else {
            return List.of();
        }

        if (event.providerAccountId() == null) {
            return candidates;
        }
        return candidates.stream()
                .filter(connection -> event.providerAccountId().equals(connection.getProviderAccountId()))
                .toList();
    }
}
