package com.gatekeeper.authgovernor.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Caller-facing view of a block in force at a given instant.
 */
public record BlockInfo(
        UUID blockId,
        BlockType blockType,
        int blockLevel,
        int consecutiveBlocks,
        OffsetDateTime blockedAt,
        OffsetDateTime blockedUntil,
        long remainingSeconds,
        String remainingFormatted,
        String messageAr,
        String messageEn
) {

    public static BlockInfo of(SecurityBlock block, OffsetDateTime now) {
        long remaining = block.remainingSeconds(now);
        return new BlockInfo(
                block.getId(),
                block.getBlockType(),
                block.getBlockLevel(),
                block.getConsecutiveBlocks(),
                block.getBlockedAt(),
                block.getBlockedUntil(),
                remaining,
                BlockMessages.formatRemainingAr(remaining),
                BlockMessages.blockNoticeAr(block.getBlockType(), remaining),
                BlockMessages.blockNoticeEn(block.getBlockType(), remaining));
    }
}
