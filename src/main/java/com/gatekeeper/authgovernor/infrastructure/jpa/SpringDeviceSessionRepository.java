package com.gatekeeper.authgovernor.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringDeviceSessionRepository extends JpaRepository<DeviceSessionEntity, UUID> {

    Optional<DeviceSessionEntity> findFirstByUserIdAndDeviceIdAndActiveTrue(UUID userId, String deviceId);

    Optional<DeviceSessionEntity> findFirstByUserIdAndIpAddressAndDeviceIdIsNullAndActiveTrue(UUID userId, String ipAddress);

    /** Active sessions, least recently used first. */
    List<DeviceSessionEntity> findByUserIdAndActiveTrueOrderByLastUsedAtAscLoggedInAtAsc(UUID userId);

    List<DeviceSessionEntity> findByUserIdOrderByLastUsedAtDesc(UUID userId);

    List<DeviceSessionEntity> findByUserIdAndActiveTrueOrderByLastUsedAtDesc(UUID userId);

    Optional<DeviceSessionEntity> findByIdAndUserId(UUID id, UUID userId);

    Optional<DeviceSessionEntity> findByUserIdAndSessionTokenAndActiveTrue(UUID userId, String sessionToken);

    boolean existsByUserIdAndSessionTokenAndActiveTrue(UUID userId, String sessionToken);

    long countByUserIdAndActiveTrue(UUID userId);

    @Modifying
    @Query("UPDATE DeviceSessionEntity s SET s.lastUsedAt = :now WHERE s.sessionToken = :token AND s.active = true")
    int touch(@Param("token") String sessionToken, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeviceSessionEntity s SET s.active = false, s.deactivatedAt = :now, s.deactivationReason = :reason " +
            "WHERE s.userId = :userId AND s.active = true")
    int deactivateAllForUser(@Param("userId") UUID userId,
                             @Param("now") OffsetDateTime now,
                             @Param("reason") String reason);
}
