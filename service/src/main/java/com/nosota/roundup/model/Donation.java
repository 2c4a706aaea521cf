package com.nosota.roundup.model;

import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.api.model.SettlementTrigger;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Donation entity - the settlement of a batch of round-ups through the payment processor.
 *
 * <p>Once created, the donation is the authoritative record of the financial outcome;
 * the settled transactions only keep a back-reference.
 *
 * <p>Example:
 * <pre>
 * Donation for config C:
 *   - Base amount: 12.00 (from 30 round-ups)
 *   - Processor fee: 0.65, tax: 0.07
 *   - coverFees = true → total charged 12.72, net to cause 12.00
 * </pre>
 */
@Entity
@Table(name = "donation")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Donation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "round_up_config_id", nullable = false)
    private UUID roundUpConfigId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "cause_id", nullable = false)
    private Long causeId;

    @Column(name = "payment_method_id", nullable = false)
    private String paymentMethodId;

    /**
     * Connected payout account of the organization at the processor.
     */
    @Column(name = "destination_account")
    private String destinationAccount;

    /**
     * Sum of the settled round-ups.
     */
    @Column(name = "base_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal baseAmount;

    @Column(name = "processor_fee", nullable = false, precision = 19, scale = 2)
    private BigDecimal processorFee;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_fee", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalFee;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "total_charged", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCharged;

    @Column(name = "cover_fees", nullable = false)
    private boolean coverFees;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "special_message", length = 250)
    private String specialMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DonationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private SettlementTrigger trigger;

    /**
     * Format: "roundup_{configId}_{yyyy-MM}_{sequence}". Also sent to the processor as its idempotency key.
     */
    @Column(name = "idempotency_key", nullable = false, unique = true)
    private String idempotencyKey;

    /**
     * Month the settlement was opened in (yyyy-MM).
     */
    @Column(name = "settlement_period", nullable = false, length = 7)
    private String settlementPeriod;

    @Column(name = "transaction_count", nullable = false)
    private int transactionCount;

    @Column(name = "processor_charge_id")
    private String processorChargeId;

    /**
     * Part of the base amount actually taken off the config's current month total when the charge was accepted.
     * Smaller than the base amount when the donation settles round-ups from before a monthly reset.
     * Exactly this amount is restored when the charge later fails.
     */
    @Column(name = "deducted_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal deductedAmount;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "charge_requested_at")
    private LocalDateTime chargeRequestedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
