package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.BlockInfo;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.SecurityBlock;
import com.gatekeeper.authgovernor.exception.ResourceNotFoundException;
import com.gatekeeper.authgovernor.infrastructure.adapters.SecurityRecordMapper;
import com.gatekeeper.authgovernor.infrastructure.jpa.AttemptRecordEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.SecurityBlockEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAttemptRecordRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringSecurityBlockRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side for operators: filtered listings, statistics and per-number history.
 */
@Service
@Transactional(readOnly = true)
public class SecurityReportService {

    static final int TOP_BLOCKED_LIMIT = 10;
    static final int HISTORY_ATTEMPT_LIMIT = 50;

    private final SpringSecurityBlockRepository blocks;
    private final SpringAttemptRecordRepository attempts;
    private final ProgressiveBlockService blocking;
    private final Clock clock;

    public SecurityReportService(SpringSecurityBlockRepository blocks,
                                 SpringAttemptRecordRepository attempts,
                                 ProgressiveBlockService blocking,
                                 Clock clock) {
        this.blocks = blocks;
        this.attempts = attempts;
        this.blocking = blocking;
        this.clock = clock;
    }

    // ===================================================================================
    // BLOCKS
    // ===================================================================================

    public Page<SecurityBlock> searchBlocks(BlockFilter filter, int page, int size) {
        Specification<SecurityBlockEntity> spec = Specification.where(null);
        if (filter.active() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("active"), filter.active()));
        }
        if (filter.blockType() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("blockType"), filter.blockType()));
        }
        if (hasText(filter.phoneNumber())) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("phoneNumber"), filter.phoneNumber().trim()));
        }
        if (hasText(filter.search())) {
            String pattern = like(filter.search());
            spec = spec.and((root, q, cb) -> cb.or(
                    cb.like(root.<String>get("phoneNumber"), pattern),
                    cb.like(cb.lower(cb.coalesce(root.<String>get("unblockReason"), "")), pattern)));
        }
        Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "blockedAt"));
        return blocks.findAll(spec, pageable).map(SecurityRecordMapper::toDomain);
    }

    public SecurityBlock getBlock(UUID blockId) {
        return blocks.findById(blockId)
                .map(SecurityRecordMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Block not found: " + blockId));
    }

    // ===================================================================================
    // ATTEMPTS
    // ===================================================================================

    public Page<AttemptRecord> searchAttempts(AttemptFilter filter, int page, int size) {
        Specification<AttemptRecordEntity> spec = Specification.where(null);
        if (hasText(filter.phoneNumber())) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("phoneNumber"), filter.phoneNumber().trim()));
        }
        if (filter.attemptType() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("attemptType"), filter.attemptType()));
        }
        if (filter.result() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("result"), filter.result()));
        }
        if (filter.dateFrom() != null) {
            OffsetDateTime from = filter.dateFrom().atStartOfDay().atOffset(ZoneOffset.UTC);
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.<OffsetDateTime>get("attemptedAt"), from));
        }
        if (filter.dateTo() != null) {
            OffsetDateTime toExclusive = filter.dateTo().plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);
            spec = spec.and((root, q, cb) -> cb.lessThan(root.<OffsetDateTime>get("attemptedAt"), toExclusive));
        }
        if (hasText(filter.search())) {
            String pattern = like(filter.search());
            spec = spec.and((root, q, cb) -> cb.or(
                    cb.like(root.<String>get("phoneNumber"), pattern),
                    cb.like(cb.lower(cb.coalesce(root.<String>get("ipAddress"), "")), pattern),
                    cb.like(cb.lower(cb.coalesce(root.<String>get("failureReason"), "")), pattern)));
        }
        Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "attemptedAt"));
        return attempts.findAll(spec, pageable).map(SecurityRecordMapper::toDomain);
    }

    public AttemptRecord getAttempt(UUID attemptId) {
        return attempts.findById(attemptId)
                .map(SecurityRecordMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt not found: " + attemptId));
    }

    // ===================================================================================
    // STATISTICS
    // ===================================================================================

    public SecurityStats stats() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime startOfToday = now.toLocalDate().atStartOfDay().atOffset(now.getOffset());
        OffsetDateTime weekAgo = now.minusDays(7);

        List<PhoneCount> topBlocked = new ArrayList<>();
        for (Object[] row : blocks.topBlockedNumbersSince(weekAgo, PageRequest.of(0, TOP_BLOCKED_LIMIT))) {
            topBlocked.add(new PhoneCount((String) row[0], ((Number) row[1]).longValue()));
        }

        Map<BlockType, Long> distribution = new EnumMap<>(BlockType.class);
        for (Object[] row : blocks.countByBlockTypeSince(weekAgo)) {
            distribution.put((BlockType) row[0], ((Number) row[1]).longValue());
        }

        return new SecurityStats(
                blocks.count(),
                blocks.countByActiveTrueAndBlockedUntilAfter(now),
                blocks.countByBlockedAtGreaterThanEqual(startOfToday),
                blocks.countByBlockedAtGreaterThanEqual(weekAgo),
                attempts.count(),
                attempts.countByResultAndAttemptedAtGreaterThanEqual(AttemptResult.FAILED, startOfToday),
                attempts.countByResultAndAttemptedAtGreaterThanEqual(AttemptResult.BLOCKED, startOfToday),
                topBlocked,
                distribution);
    }

    // ===================================================================================
    // PHONE HISTORY
    // ===================================================================================

    /** Full picture for one number. The current status check may deactivate expired blocks. */
    public PhoneHistory phoneHistory(String phoneNumber) {
        String phone = phoneNumber.trim();
        Optional<BlockInfo> current = blocking.getBlockStatus(phone, null);

        List<SecurityBlock> allBlocks = blocks.findByPhoneNumberOrderByBlockedAtDesc(phone).stream()
                .map(SecurityRecordMapper::toDomain)
                .toList();
        List<AttemptRecord> recent = attempts.findByPhoneNumberOrderByAttemptedAtDesc(
                        phone, PageRequest.of(0, HISTORY_ATTEMPT_LIMIT)).stream()
                .map(SecurityRecordMapper::toDomain)
                .toList();

        return new PhoneHistory(
                phone,
                current.orElse(null),
                attempts.countByPhoneNumber(phone),
                attempts.countByPhoneNumberAndResult(phone, AttemptResult.SUCCESS),
                attempts.countByPhoneNumberAndResult(phone, AttemptResult.FAILED),
                attempts.countByPhoneNumberAndResult(phone, AttemptResult.BLOCKED),
                blocks.countByPhoneNumber(phone),
                blocks.countByPhoneNumberAndActiveTrue(phone),
                allBlocks,
                recent);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String like(String search) {
        return "%" + search.trim().toLowerCase() + "%";
    }

    // ===================================================================================
    // RESULT TYPES
    // ===================================================================================

    public record BlockFilter(Boolean active, BlockType blockType, String phoneNumber, String search) {
    }

    public record AttemptFilter(String phoneNumber, AttemptType attemptType, AttemptResult result,
                                LocalDate dateFrom, LocalDate dateTo, String search) {
    }

    public record PhoneCount(String phoneNumber, long count) {
    }

    public record SecurityStats(
            long totalBlocks,
            long activeBlocks,
            long blocksToday,
            long blocksThisWeek,
            long totalAttempts,
            long failedAttemptsToday,
            long blockedAttemptsToday,
            List<PhoneCount> topBlockedNumbersThisWeek,
            Map<BlockType, Long> blockTypeDistributionThisWeek
    ) {
    }

    public record PhoneHistory(
            String phoneNumber,
            BlockInfo currentBlock,
            long totalAttempts,
            long successfulAttempts,
            long failedAttempts,
            long blockedAttempts,
            long totalBlocks,
            long activeBlocks,
            List<SecurityBlock> blocks,
            List<AttemptRecord> recentAttempts
    ) {
    }
}
