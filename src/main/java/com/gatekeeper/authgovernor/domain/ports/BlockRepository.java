package com.gatekeeper.authgovernor.domain.ports;

import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.SecurityBlock;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BlockRepository {

    SecurityBlock save(SecurityBlock block);

    Optional<SecurityBlock> findById(UUID blockId);

    /** Active blocks whose type restricts {@code attemptType} (exact or combined), newest first. */
    List<SecurityBlock> findActiveCovering(String phoneNumber, AttemptType attemptType);

    /** All active blocks for the number, newest first. */
    List<SecurityBlock> findActive(String phoneNumber);

    /** Most recent block for the number that an operator lifted. */
    Optional<SecurityBlock> findLatestManuallyUnblocked(String phoneNumber);

    /** Most recent block of exactly {@code blockType} created at or after {@code since}. */
    Optional<SecurityBlock> findLatestSince(String phoneNumber, BlockType blockType, OffsetDateTime since);

    int deactivateExpired(OffsetDateTime now);

    int purgeInactiveOlderThan(OffsetDateTime cutoff);
}
