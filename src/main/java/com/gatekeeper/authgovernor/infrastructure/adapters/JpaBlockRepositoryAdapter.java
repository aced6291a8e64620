package com.gatekeeper.authgovernor.infrastructure.adapters;

import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.SecurityBlock;
import com.gatekeeper.authgovernor.domain.ports.BlockRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringSecurityBlockRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaBlockRepositoryAdapter implements BlockRepository {
    private final SpringSecurityBlockRepository blocks;

    public JpaBlockRepositoryAdapter(SpringSecurityBlockRepository blocks) {
        this.blocks = blocks;
    }

    @Override
    public SecurityBlock save(SecurityBlock block) {
        blocks.save(SecurityRecordMapper.toEntity(block));
        return block;
    }

    @Override
    public Optional<SecurityBlock> findById(UUID blockId) {
        return blocks.findById(blockId).map(SecurityRecordMapper::toDomain);
    }

    @Override
    public List<SecurityBlock> findActiveCovering(String phoneNumber, AttemptType attemptType) {
        return blocks.findActiveByTypes(phoneNumber, BlockType.covering(attemptType))
                .stream()
                .map(SecurityRecordMapper::toDomain)
                .toList();
    }

    @Override
    public List<SecurityBlock> findActive(String phoneNumber) {
        return blocks.findByPhoneNumberAndActiveTrueOrderByBlockedAtDesc(phoneNumber)
                .stream()
                .map(SecurityRecordMapper::toDomain)
                .toList();
    }

    @Override
    public Optional<SecurityBlock> findLatestManuallyUnblocked(String phoneNumber) {
        return blocks.findFirstByPhoneNumberAndManuallyUnblockedTrueAndUnblockedAtIsNotNullOrderByUnblockedAtDesc(phoneNumber)
                .map(SecurityRecordMapper::toDomain);
    }

    @Override
    public Optional<SecurityBlock> findLatestSince(String phoneNumber, BlockType blockType, OffsetDateTime since) {
        return blocks.findFirstByPhoneNumberAndBlockTypeAndBlockedAtGreaterThanEqualOrderByBlockedAtDesc(
                        phoneNumber, blockType, since)
                .map(SecurityRecordMapper::toDomain);
    }

    @Override
    @Transactional
    public int deactivateExpired(OffsetDateTime now) {
        return blocks.deactivateExpired(now);
    }

    @Override
    @Transactional
    public int purgeInactiveOlderThan(OffsetDateTime cutoff) {
        return blocks.deleteInactiveOlderThan(cutoff);
    }
}
