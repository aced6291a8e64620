package com.gatekeeper.authgovernor.infrastructure.jpa;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface SpringAuthGuardLockRepository extends JpaRepository<AuthGuardLockEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT l FROM AuthGuardLockEntity l WHERE l.lockKey = :key")
    Optional<AuthGuardLockEntity> findForUpdate(@Param("key") String lockKey);

    /** Inserts the control row unless it already exists; returns the number of rows written. */
    @Modifying
    @Query(value = "INSERT INTO auth_guard_locks (lock_key, created_at) VALUES (:key, :createdAt) ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("key") String lockKey, @Param("createdAt") OffsetDateTime createdAt);
}
