package com.nosota.roundup.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DonationTransaction - links a donation to the round-ups it settles.
 *
 * <p>Kept after a failed settlement releases the round-ups, so the donation
 * still shows what it tried to settle.
 */
@Entity
@Table(name = "donation_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class DonationTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "donation_id", nullable = false)
    private UUID donationId;

    @Column(name = "round_up_transaction_id", nullable = false)
    private UUID roundUpTransactionId;

    @Column(name = "round_up_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal roundUpAmount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
