package com.gatekeeper.authgovernor.infrastructure.jpa;

import com.gatekeeper.authgovernor.domain.BlockType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringSecurityBlockRepository extends JpaRepository<SecurityBlockEntity, UUID>,
        JpaSpecificationExecutor<SecurityBlockEntity> {

    @Query("SELECT b FROM SecurityBlockEntity b WHERE b.phoneNumber = :phone AND b.active = true " +
            "AND b.blockType IN :types ORDER BY b.blockedAt DESC")
    List<SecurityBlockEntity> findActiveByTypes(@Param("phone") String phoneNumber,
                                                @Param("types") Collection<BlockType> types);

    List<SecurityBlockEntity> findByPhoneNumberAndActiveTrueOrderByBlockedAtDesc(String phoneNumber);

    Optional<SecurityBlockEntity> findFirstByPhoneNumberAndManuallyUnblockedTrueAndUnblockedAtIsNotNullOrderByUnblockedAtDesc(
            String phoneNumber);

    Optional<SecurityBlockEntity> findFirstByPhoneNumberAndBlockTypeAndBlockedAtGreaterThanEqualOrderByBlockedAtDesc(
            String phoneNumber, BlockType blockType, OffsetDateTime since);

    List<SecurityBlockEntity> findByPhoneNumberOrderByBlockedAtDesc(String phoneNumber);

    long countByActiveTrue();

    long countByActiveTrueAndBlockedUntilAfter(OffsetDateTime now);

    long countByBlockedAtGreaterThanEqual(OffsetDateTime since);

    long countByPhoneNumber(String phoneNumber);

    long countByPhoneNumberAndActiveTrue(String phoneNumber);

    @Query("SELECT b.phoneNumber, COUNT(b) FROM SecurityBlockEntity b WHERE b.blockedAt >= :since " +
            "GROUP BY b.phoneNumber ORDER BY COUNT(b) DESC")
    List<Object[]> topBlockedNumbersSince(@Param("since") OffsetDateTime since, Pageable pageable);

    @Query("SELECT b.blockType, COUNT(b) FROM SecurityBlockEntity b WHERE b.blockedAt >= :since GROUP BY b.blockType")
    List<Object[]> countByBlockTypeSince(@Param("since") OffsetDateTime since);

    @Modifying
    @Query("UPDATE SecurityBlockEntity b SET b.active = false WHERE b.active = true AND b.blockedUntil <= :now")
    int deactivateExpired(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM SecurityBlockEntity b WHERE b.active = false AND b.blockedAt < :cutoff")
    int deleteInactiveOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
