package com.nosota.roundup.model;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.ConnectionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * BankConnection entity - one consented bank account at an aggregator.
 *
 * <p>Connections are never deleted. Revocation, expiry or account deletion
 * only deactivate them; relinking the same account creates a new record.
 */
@Entity
@Table(name = "bank_connection")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BankConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false)
    private BankProvider provider;

    /**
     * Plaid item id or Basiq connection id. Several connections can share it
     * when the user linked more than one account of the same login.
     */
    @Column(name = "provider_connection_id", nullable = false)
    private String providerConnectionId;

    @Column(name = "provider_account_id", nullable = false)
    private String providerAccountId;

    /**
     * Handle the aggregator data calls are made with: Plaid access token or Basiq user id.
     */
    @Column(name = "provider_user_ref", nullable = false)
    private String providerUserRef;

    @Column(name = "institution_name")
    private String institutionName;

    @Column(name = "account_name")
    private String accountName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ConnectionStatus status;

    /**
     * True only while status is ACTIVE.
     */
    @Column(name = "is_active", nullable = false)
    private boolean active;

    /**
     * {@code userId:provider:accountId} while active, null afterwards.
     * Backed by a unique constraint so one account has at most one active connection per user.
     */
    @Column(name = "active_account_key", unique = true)
    private String activeAccountKey;

    /**
     * Provider error code from the last ERROR transition.
     */
    @Column(name = "error_code")
    private String errorCode;

    /**
     * Human-readable reason of the last non-active transition.
     */
    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "last_synced_at")
    private LocalDateTime lastSyncedAt;

    /**
     * Provider-side marker of the last synced position, when the provider has one.
     */
    @Column(name = "sync_cursor")
    private String syncCursor;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "deactivated_at")
    private LocalDateTime deactivatedAt;

    public static String activeAccountKey(Long userId, BankProvider provider, String providerAccountId) {
        return userId + ":" + provider + ":" + providerAccountId;
    }
}
