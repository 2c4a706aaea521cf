package com.nosota.roundup.model;

import com.nosota.roundup.api.model.RoundUpStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * RoundUpConfig entity - the per-connection accumulator.
 *
 * <p>Owns the accumulation counters. Every mutation goes through a row lock
 * taken with {@code RoundUpConfigRepository.getOneForUpdate}.
 *
 * <p>Example:
 * <pre>
 * Config for connection C (threshold 10.00):
 *   - purchase 4.60 → round-up 0.40, currentMonthTotal 0.40
 *   - ...
 *   - currentMonthTotal reaches 10.00 → settlement triggered
 * </pre>
 */
@Entity
@Table(name = "round_up_config")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RoundUpConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "bank_connection_id", nullable = false)
    private UUID bankConnectionId;

    /**
     * Equals {@link #bankConnectionId} while the config is not cancelled, null afterwards.
     * Unique, so a connection has at most one active config.
     */
    @Column(name = "active_connection_id", unique = true)
    private UUID activeConnectionId;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "cause_id", nullable = false)
    private Long causeId;

    @Column(name = "payment_method_id", nullable = false)
    private String paymentMethodId;

    /**
     * Monthly amount that forces a settlement. Null means no limit.
     */
    @Column(name = "monthly_threshold", precision = 19, scale = 2)
    private BigDecimal monthlyThreshold;

    @Column(name = "cover_fees", nullable = false)
    private boolean coverFees;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "special_message", length = 250)
    private String specialMessage;

    /**
     * Round-ups of the current month not yet handed to the processor. Never negative.
     */
    @Column(name = "current_month_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentMonthTotal;

    @Column(name = "total_accumulated", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAccumulated;

    /**
     * First day of the month {@link #currentMonthTotal} belongs to.
     */
    @Column(name = "current_period_start", nullable = false)
    private LocalDate currentPeriodStart;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RoundUpStatus status;

    /**
     * Incremented for each donation; part of the donation idempotency key.
     */
    @Column(name = "settlement_sequence", nullable = false)
    private int settlementSequence;

    @Column(name = "last_charity_switch")
    private LocalDateTime lastCharitySwitch;

    @Column(name = "last_donation_attempt")
    private LocalDateTime lastDonationAttempt;

    @Column(name = "last_failure_reason", length = 1000)
    private String lastFailureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    public boolean isCancelled() {
        return status == RoundUpStatus.CANCELLED;
    }
}
