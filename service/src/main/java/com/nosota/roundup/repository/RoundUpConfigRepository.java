package com.nosota.roundup.repository;

import com.nosota.roundup.api.model.RoundUpStatus;
import com.nosota.roundup.model.RoundUpConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link RoundUpConfig} entity operations.
 *
 * <p>All counter mutations must load the config through {@link #getOneForUpdate(UUID)}
 * as the first access to that row inside the transaction.
 */
@Repository
public interface RoundUpConfigRepository extends JpaRepository<RoundUpConfig, UUID> {

    /**
     * Retrieves the {@link RoundUpConfig} with the specified id and locks it for update.
     * <p>
     * Uses a <b>pessimistic write lock</b> ({@code SELECT ... FOR UPDATE}). Ingestion, settlement,
     * reconciliation, charity switch and cancellation all take this lock, which serializes every
     * read-modify-write of {@code currentMonthTotal} for one config.
     * </p>
     * <p>
     * <b>Note:</b> if the entity is already managed by the persistence context, the lock is taken but
     * its state is not re-read. Call this before anything else loads the same config.
     * </p>
     *
     * @param id The config id
     * @return The locked config, or null if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM RoundUpConfig c WHERE c.id = :id")
    RoundUpConfig getOneForUpdate(@Param("id") UUID id);

    /**
     * Id of the connection's active (not cancelled) config, without loading the entity.
     */
    @Query("SELECT c.id FROM RoundUpConfig c WHERE c.activeConnectionId = :connectionId")
    Optional<UUID> findActiveConfigId(@Param("connectionId") UUID connectionId);

    Optional<RoundUpConfig> findByActiveConnectionId(UUID connectionId);

    List<RoundUpConfig> findByUserIdOrderByCreatedAtDesc(Long userId);

    @Query("SELECT c.id FROM RoundUpConfig c WHERE c.status <> :excluded")
    List<UUID> findIdsByStatusNot(@Param("excluded") RoundUpStatus excluded);

    @Query("SELECT c.id FROM RoundUpConfig c WHERE c.enabled = true AND c.status <> :excluded")
    List<UUID> findEnabledIdsByStatusNot(@Param("excluded") RoundUpStatus excluded);

    /**
     * Connections whose config is active and not paused.
     */
    @Query("SELECT c.activeConnectionId FROM RoundUpConfig c WHERE c.activeConnectionId IS NOT NULL AND c.enabled = true")
    List<UUID> findSyncableConnectionIds();
}
