package com.gatekeeper.authgovernor.api.dto;

import com.gatekeeper.authgovernor.domain.BlockMessages;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.FailedAttemptSummary;
import com.gatekeeper.authgovernor.domain.SecurityBlock;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record BlockView(
        UUID id,
        String phoneNumber,
        BlockType blockType,
        OffsetDateTime blockedAt,
        OffsetDateTime blockedUntil,
        int blockLevel,
        int consecutiveBlocks,
        boolean active,
        boolean inForce,
        long remainingSeconds,
        String remainingTimeFormatted,
        boolean manuallyUnblocked,
        String unblockedBy,
        OffsetDateTime unblockedAt,
        String unblockReason,
        List<FailedAttemptSummary> failedAttempts,
        List<String> ipAddresses,
        List<String> userAgents,
        List<String> deviceIds
) {

    public static BlockView from(SecurityBlock b, OffsetDateTime now) {
        long remaining = b.isInForce(now) ? b.remainingSeconds(now) : 0;
        return new BlockView(b.getId(), b.getPhoneNumber(), b.getBlockType(), b.getBlockedAt(), b.getBlockedUntil(),
                b.getBlockLevel(), b.getConsecutiveBlocks(), b.isActive(), b.isInForce(now), remaining,
                BlockMessages.formatRemainingAr(remaining), b.isManuallyUnblocked(), b.getUnblockedBy(),
                b.getUnblockedAt(), b.getUnblockReason(), b.getFailedAttempts(), b.getIpAddresses(),
                b.getUserAgents(), b.getDeviceIds());
    }
}
