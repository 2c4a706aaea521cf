package com.nosota.roundup.repository;

import com.nosota.roundup.api.model.BankProvider;
import com.nosota.roundup.model.BankConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link BankConnection} entity operations.
 */
@Repository
public interface BankConnectionRepository extends JpaRepository<BankConnection, UUID> {

    /**
     * Retrieves the connection and locks it for update.
     * Used by lifecycle transitions so two webhook deliveries cannot transition the same
     * connection concurrently.
     *
     * @param id Connection id
     * @return The locked connection, or null if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM BankConnection c WHERE c.id = :id")
    BankConnection getOneForUpdate(@Param("id") UUID id);

    Optional<BankConnection> findByActiveAccountKey(String activeAccountKey);

    List<BankConnection> findByProviderAndProviderConnectionId(BankProvider provider, String providerConnectionId);

    List<BankConnection> findByProviderAndProviderUserRef(BankProvider provider, String providerUserRef);

    List<BankConnection> findByProviderAndProviderAccountId(BankProvider provider, String providerAccountId);

    long countByProviderAndProviderConnectionIdAndActiveTrue(BankProvider provider, String providerConnectionId);

    @Transactional
    @Modifying
    @Query("UPDATE BankConnection c SET c.lastSyncedAt = :syncedAt WHERE c.id = :id")
    int updateLastSyncedAt(@Param("id") UUID id, @Param("syncedAt") LocalDateTime syncedAt);
}
