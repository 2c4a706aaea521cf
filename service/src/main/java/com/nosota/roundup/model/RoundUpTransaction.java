package com.nosota.roundup.model;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * RoundUpTransaction entity - one provider transaction accepted into the ledger.
 *
 * <p>The provider transaction id is unique at the storage level, so a re-delivered
 * webhook can never create a second record.
 */
@Entity
@Table(name = "round_up_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RoundUpTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "bank_connection_id", nullable = false)
    private UUID bankConnectionId;

    @Column(name = "round_up_config_id", nullable = false)
    private UUID roundUpConfigId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false)
    private BankProvider provider;

    @Column(name = "provider_transaction_id", nullable = false, unique = true)
    private String providerTransactionId;

    /**
     * Purchase amount as a positive magnitude.
     */
    @Column(name = "original_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal originalAmount;

    @Column(name = "round_up_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal roundUpAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(name = "transaction_name", length = 500)
    private String transactionName;

    @Convert(converter = CategoryListConverter.class)
    @Column(name = "categories", length = 1000)
    private List<String> categories;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RoundUpTransactionStatus status;

    /**
     * Donation currently settling this round-up. Cleared when that settlement fails.
     */
    @Column(name = "donation_id")
    private UUID donationId;

    @Column(name = "donation_attempted_at")
    private LocalDateTime donationAttemptedAt;

    @Column(name = "donated_at")
    private LocalDateTime donatedAt;

    @Column(name = "last_payment_failure")
    private LocalDateTime lastPaymentFailure;

    @Column(name = "last_payment_failure_reason", length = 1000)
    private String lastPaymentFailureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
