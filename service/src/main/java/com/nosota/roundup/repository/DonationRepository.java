package com.nosota.roundup.repository;

import com.nosota.roundup.api.model.DonationStatus;
import com.nosota.roundup.model.Donation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Donation} entity operations.
 *
 * <p>Provides data access methods for settlement operations including:
 * <ul>
 *   <li>In-flight lookup for the duplicate-trigger guard</li>
 *   <li>Stale PENDING lookup for the recovery sweep</li>
 *   <li>Paginated history queries</li>
 * </ul>
 */
@Repository
public interface DonationRepository extends JpaRepository<Donation, UUID> {

    /**
     * Config id of a donation, without loading the donation into the persistence context.
     */
    @Query("SELECT d.roundUpConfigId FROM Donation d WHERE d.id = :id")
    Optional<UUID> findConfigIdById(@Param("id") UUID donationId);

    Optional<Donation> findFirstByRoundUpConfigIdAndStatusIn(UUID roundUpConfigId, Collection<DonationStatus> statuses);

    Optional<Donation> findByIdempotencyKey(String idempotencyKey);

    Page<Donation> findByRoundUpConfigIdOrderByCreatedAtDesc(UUID roundUpConfigId, Pageable pageable);

    @Query("SELECT d.id FROM Donation d WHERE d.status = :status AND d.createdAt < :createdBefore ORDER BY d.createdAt ASC")
    List<UUID> findIdsByStatusAndCreatedAtBefore(@Param("status") DonationStatus status,
                                                 @Param("createdBefore") LocalDateTime createdBefore);

    @Query("""
            SELECT COALESCE(SUM(d.baseAmount), 0) FROM Donation d
            WHERE d.roundUpConfigId = :configId AND d.status = :status
            """)
    BigDecimal sumBaseAmount(@Param("configId") UUID roundUpConfigId, @Param("status") DonationStatus status);
}
