package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.config.SecurityGovernorProperties;
import com.gatekeeper.authgovernor.domain.AttemptDecision;
import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.BlockInfo;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.FailedAttemptSummary;
import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.SecurityBlock;
import com.gatekeeper.authgovernor.domain.ports.AttemptLedger;
import com.gatekeeper.authgovernor.domain.ports.BlockRepository;
import com.gatekeeper.authgovernor.domain.ports.NotifierPort;
import com.gatekeeper.authgovernor.domain.ports.PhoneNumberLock;
import com.gatekeeper.authgovernor.exception.CapacityRaceException;
import com.gatekeeper.authgovernor.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Sliding-window failure counting with escalating blocks per phone number.
 *
 * <p>Every public operation runs in its own transaction. Failed attempts take the
 * per-number lock before reading block state, so two concurrent failures can never
 * both open a block.
 */
@Service
public class ProgressiveBlockService {

    private static final Logger log = LoggerFactory.getLogger(ProgressiveBlockService.class);

    public static final String DEFAULT_UNBLOCK_REASON = "Manually unblocked by operator";

    private final AttemptLedger ledger;
    private final BlockRepository blocks;
    private final PhoneNumberLock phoneLock;
    private final NotifierPort notifier;
    private final Clock clock;
    private final SecurityGovernorProperties.Blocking config;
    private final TransactionTemplate tx;

    public ProgressiveBlockService(AttemptLedger ledger,
                                   BlockRepository blocks,
                                   PhoneNumberLock phoneLock,
                                   NotifierPort notifier,
                                   Clock clock,
                                   SecurityGovernorProperties properties,
                                   PlatformTransactionManager transactionManager) {
        properties.getBlocking().validate();
        this.ledger = ledger;
        this.blocks = blocks;
        this.phoneLock = phoneLock;
        this.notifier = notifier;
        this.clock = clock;
        this.config = properties.getBlocking();
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        log.info("ProgressiveBlockService initialized - threshold: {}, window: {}min, durations: {}min, reset after: {}h",
                config.getMaxFailedAttempts(), config.getAttemptWindowMinutes(),
                config.getBlockDurationsMinutes(), config.getResetAfterHours());
    }

    // ===================================================================================
    // ATTEMPTS
    // ===================================================================================

    public AttemptDecision recordAttempt(String phoneNumber, AttemptType attemptType, boolean success,
                                         String ipAddress, String userAgent, String deviceId,
                                         String failureReason) {
        requirePhoneNumber(phoneNumber);
        if (attemptType == null) {
            throw new IllegalArgumentException("attemptType is required");
        }

        AttemptDecision decision = withRaceRetry(phoneNumber, status ->
                doRecordAttempt(phoneNumber, attemptType, success, ipAddress, userAgent, deviceId, failureReason));

        if (decision.isNewlyBlocked()) {
            notifier.blockCreated(phoneNumber, decision.getBlockInfo());
        }
        return decision;
    }

    /**
     * Pre-credential gate. When a block is in force the rejection is recorded and
     * the block returned; otherwise nothing is written.
     */
    public Optional<BlockInfo> checkBlocked(String phoneNumber, AttemptType attemptType,
                                            String ipAddress, String userAgent, String deviceId) {
        requirePhoneNumber(phoneNumber);
        return withRaceRetry(phoneNumber, status -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            return currentBlock(phoneNumber, attemptType, now)
                    .map(block -> rejectBlocked(block, phoneNumber, attemptType, ipAddress, userAgent, deviceId, now));
        });
    }

    private AttemptDecision doRecordAttempt(String phoneNumber, AttemptType attemptType, boolean success,
                                            String ipAddress, String userAgent, String deviceId,
                                            String failureReason) {
        if (!success) {
            // all reads and writes on the failure path happen under the number's lock
            phoneLock.acquire(phoneNumber);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<SecurityBlock> inForce = currentBlock(phoneNumber, attemptType, now);
        if (inForce.isPresent()) {
            return AttemptDecision.blocked(
                    rejectBlocked(inForce.get(), phoneNumber, attemptType, ipAddress, userAgent, deviceId, now));
        }

        AttemptResult result = success ? AttemptResult.SUCCESS : AttemptResult.FAILED;
        ledger.append(AttemptRecord.create(phoneNumber, attemptType, result, now,
                ipAddress, userAgent, deviceId, success ? null : failureReason, null));

        if (success) {
            log.debug("✅ {} attempt succeeded for {}", attemptType, PhoneNumbers.mask(phoneNumber));
            return AttemptDecision.allowed();
        }

        long failures = countRecentFailures(phoneNumber, attemptType, now);
        int threshold = config.getMaxFailedAttempts();
        if (failures < threshold) {
            int remaining = (int) Math.max(0, threshold - failures);
            log.warn("❌ {} attempt failed for {} - {} of {} failures in window, {} remaining",
                    attemptType, PhoneNumbers.mask(phoneNumber), failures, threshold, remaining);
            return AttemptDecision.allowedWithWarning(remaining);
        }

        SecurityBlock block = openBlock(phoneNumber, attemptType, now);
        return AttemptDecision.thresholdExceeded(BlockInfo.of(block, now));
    }

    /** Newest block in force for the attempt type; expired ones found on the way are deactivated. */
    private Optional<SecurityBlock> currentBlock(String phoneNumber, AttemptType attemptType, OffsetDateTime now) {
        return firstInForce(blocks.findActiveCovering(phoneNumber, attemptType), now);
    }

    private Optional<SecurityBlock> firstInForce(List<SecurityBlock> active, OffsetDateTime now) {
        SecurityBlock found = null;
        for (SecurityBlock block : active) {
            if (block.isExpired(now)) {
                block.expire();
                blocks.save(block);
                log.info("Block {} expired at {}, deactivated", block.getId(), block.getBlockedUntil());
            } else if (found == null) {
                found = block;
            }
        }
        return Optional.ofNullable(found);
    }

    private BlockInfo rejectBlocked(SecurityBlock block, String phoneNumber, AttemptType attemptType,
                                    String ipAddress, String userAgent, String deviceId, OffsetDateTime now) {
        ledger.append(AttemptRecord.create(phoneNumber, attemptType, AttemptResult.BLOCKED, now,
                ipAddress, userAgent, deviceId, "Blocked until " + block.getBlockedUntil(), block.getId()));
        log.warn("🚫 {} attempt rejected for {} - block {} (level {}) in force until {}",
                attemptType, PhoneNumbers.mask(phoneNumber), block.getId(), block.getBlockLevel(), block.getBlockedUntil());
        return BlockInfo.of(block, now);
    }

    /**
     * Failed attempts inside the window. The window never reaches back past the
     * most recent manual unblock for the number.
     */
    private long countRecentFailures(String phoneNumber, AttemptType attemptType, OffsetDateTime now) {
        OffsetDateTime since = now.minus(config.attemptWindow());
        Optional<SecurityBlock> lastManual = blocks.findLatestManuallyUnblocked(phoneNumber);
        if (lastManual.isPresent() && lastManual.get().getUnblockedAt().isAfter(since)) {
            since = lastManual.get().getUnblockedAt();
        }
        return ledger.countFailedSince(phoneNumber, attemptType, since);
    }

    private SecurityBlock openBlock(String phoneNumber, AttemptType attemptType, OffsetDateTime now) {
        BlockType blockType = BlockType.of(attemptType);
        Optional<SecurityBlock> previous = blocks.findLatestSince(phoneNumber, blockType, now.minus(config.resetAfter()));

        int level;
        int consecutive;
        if (previous.isEmpty() || previous.get().isManuallyUnblocked()) {
            level = 1;
            consecutive = 1;
        } else {
            level = Math.min(previous.get().getBlockLevel() + 1, config.maxBlockLevel());
            consecutive = previous.get().getConsecutiveBlocks() + 1;
        }
        Duration duration = config.durationForLevel(level);

        List<AttemptRecord> evidence = ledger.findRecentFailed(phoneNumber, attemptType, config.getMaxFailedAttempts());
        List<FailedAttemptSummary> summaries = new ArrayList<>();
        Set<String> ips = new LinkedHashSet<>();
        Set<String> agents = new LinkedHashSet<>();
        Set<String> devices = new LinkedHashSet<>();
        for (AttemptRecord attempt : evidence) {
            summaries.add(FailedAttemptSummary.of(attempt));
            addIfPresent(ips, attempt.getIpAddress());
            addIfPresent(agents, truncate(attempt.getUserAgent(), config.getEvidenceUserAgentMaxLength()));
            addIfPresent(devices, attempt.getDeviceId());
        }

        SecurityBlock block = SecurityBlock.open(phoneNumber, blockType, now, duration, level, consecutive,
                summaries, new ArrayList<>(ips), new ArrayList<>(agents), new ArrayList<>(devices));
        blocks.save(block);

        log.info("🔒 Opened {} block {} for {} - level {}, streak {}, until {}",
                blockType, block.getId(), PhoneNumbers.mask(phoneNumber), level, consecutive, block.getBlockedUntil());
        return block;
    }

    // ===================================================================================
    // STATUS AND OPERATOR ACTIONS
    // ===================================================================================

    /** Block in force for the number; a null type means any type. */
    public Optional<BlockInfo> getBlockStatus(String phoneNumber, AttemptType attemptType) {
        requirePhoneNumber(phoneNumber);
        return tx.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<SecurityBlock> active = attemptType == null
                    ? blocks.findActive(phoneNumber)
                    : blocks.findActiveCovering(phoneNumber, attemptType);
            return firstInForce(active, now).map(block -> BlockInfo.of(block, now));
        });
    }

    /**
     * Lifts every active block for the number and resets its escalation streak.
     *
     * @return number of blocks lifted
     */
    public int manuallyUnblock(String phoneNumber, String operator, String reason) {
        requirePhoneNumber(phoneNumber);
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_UNBLOCK_REASON : reason;

        Integer count = withRaceRetry(phoneNumber, status -> {
            phoneLock.acquire(phoneNumber);
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<SecurityBlock> active = blocks.findActive(phoneNumber);
            for (SecurityBlock block : active) {
                block.unblockManually(operator, now, effectiveReason);
                blocks.save(block);
            }
            return active.size();
        });

        log.info("🔓 {} block(s) lifted for {} by {}", count, PhoneNumbers.mask(phoneNumber), operator);
        return count;
    }

    /** Lifts a single block by id. */
    public SecurityBlock liftBlock(UUID blockId, String operator, String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_UNBLOCK_REASON : reason;
        SecurityBlock lifted = tx.execute(status -> {
            SecurityBlock block = blocks.findById(blockId)
                    .orElseThrow(() -> new ResourceNotFoundException("Block not found: " + blockId));
            if (!block.isActive()) {
                throw new IllegalStateException("Block " + blockId + " is already inactive");
            }
            block.unblockManually(operator, OffsetDateTime.now(clock), effectiveReason);
            blocks.save(block);
            return block;
        });
        log.info("🔓 Block {} lifted by {}", blockId, operator);
        return lifted;
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================

    private <T> T withRaceRetry(String phoneNumber, TransactionCallback<T> work) {
        try {
            return tx.execute(work);
        } catch (CapacityRaceException | ConcurrencyFailureException | TransactionException e) {
            log.warn("Concurrent update for {} ({}), retrying once", PhoneNumbers.mask(phoneNumber), e.getMessage());
            try {
                return tx.execute(work);
            } catch (ConcurrencyFailureException | TransactionException again) {
                throw new CapacityRaceException("Concurrent update conflict for " + PhoneNumbers.mask(phoneNumber), again);
            }
        }
    }

    private static void requirePhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("phoneNumber is required");
        }
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
