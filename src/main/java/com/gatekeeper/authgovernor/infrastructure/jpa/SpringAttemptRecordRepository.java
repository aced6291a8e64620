package com.gatekeeper.authgovernor.infrastructure.jpa;

import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface SpringAttemptRecordRepository extends JpaRepository<AttemptRecordEntity, UUID>,
        JpaSpecificationExecutor<AttemptRecordEntity> {

    @Query("SELECT COUNT(a) FROM AttemptRecordEntity a WHERE a.phoneNumber = :phone AND a.attemptType = :type " +
            "AND a.result = :result AND a.attemptedAt >= :since")
    long countSince(@Param("phone") String phoneNumber,
                    @Param("type") AttemptType attemptType,
                    @Param("result") AttemptResult result,
                    @Param("since") OffsetDateTime since);

    List<AttemptRecordEntity> findByPhoneNumberAndAttemptTypeAndResultOrderByAttemptedAtDesc(
            String phoneNumber, AttemptType attemptType, AttemptResult result, Pageable pageable);

    List<AttemptRecordEntity> findByPhoneNumberOrderByAttemptedAtDesc(String phoneNumber, Pageable pageable);

    long countByPhoneNumber(String phoneNumber);

    long countByPhoneNumberAndResult(String phoneNumber, AttemptResult result);

    long countByResultAndAttemptedAtGreaterThanEqual(AttemptResult result, OffsetDateTime since);

    @Modifying
    @Query("DELETE FROM AttemptRecordEntity a WHERE a.attemptedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
