package com.nosota.roundup.repository;

import com.nosota.roundup.api.model.RoundUpTransactionStatus;
import com.nosota.roundup.model.RoundUpTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Repository for {@link RoundUpTransaction} entity operations.
 */
@Repository
public interface RoundUpTransactionRepository extends JpaRepository<RoundUpTransaction, UUID> {

    boolean existsByProviderTransactionId(String providerTransactionId);

    /**
     * Round-ups of a config waiting for settlement: PROCESSED and not assigned to a donation.
     *
     * @param roundUpConfigId The config id
     * @return Unassigned round-ups, oldest first
     */
    @Query("""
            SELECT t FROM RoundUpTransaction t
            WHERE t.roundUpConfigId = :configId
              AND t.status = com.nosota.roundup.api.model.RoundUpTransactionStatus.PROCESSED
              AND t.donationId IS NULL
            ORDER BY t.createdAt ASC
            """)
    List<RoundUpTransaction> findUnsettled(@Param("configId") UUID roundUpConfigId);

    List<RoundUpTransaction> findByDonationId(UUID donationId);

    List<RoundUpTransaction> findByRoundUpConfigIdOrderByCreatedAtAsc(UUID roundUpConfigId);

    Page<RoundUpTransaction> findByRoundUpConfigIdOrderByCreatedAtDesc(UUID roundUpConfigId, Pageable pageable);

    Page<RoundUpTransaction> findByRoundUpConfigIdAndStatusOrderByCreatedAtDesc(UUID roundUpConfigId,
                                                                               RoundUpTransactionStatus status,
                                                                               Pageable pageable);

    long countByRoundUpConfigIdAndStatus(UUID roundUpConfigId, RoundUpTransactionStatus status);

    @Query("""
            SELECT COALESCE(SUM(t.roundUpAmount), 0) FROM RoundUpTransaction t
            WHERE t.roundUpConfigId = :configId AND t.status = :status
            """)
    BigDecimal sumRoundUpAmount(@Param("configId") UUID roundUpConfigId,
                                @Param("status") RoundUpTransactionStatus status);
}
