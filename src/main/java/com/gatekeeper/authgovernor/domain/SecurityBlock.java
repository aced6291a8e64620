// ==============================================================================
// Security Block Domain Model
// File: src/main/java/com/gatekeeper/authgovernor/domain/SecurityBlock.java
// ==============================================================================

package com.gatekeeper.authgovernor.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A time-boxed restriction on authentication attempts for one phone number.
 * Identity and evidence are fixed at creation; only the activation state changes.
 */
public class SecurityBlock {
    private final UUID id;
    private final String phoneNumber;
    private final BlockType blockType;
    private final OffsetDateTime blockedAt;
    private final OffsetDateTime blockedUntil;
    private final int blockLevel;
    private final int consecutiveBlocks;
    private final List<FailedAttemptSummary> failedAttempts;
    private final List<String> ipAddresses;
    private final List<String> userAgents;
    private final List<String> deviceIds;

    private boolean active;
    private boolean manuallyUnblocked;
    private String unblockedBy;
    private OffsetDateTime unblockedAt;
    private String unblockReason;

    public SecurityBlock(UUID id, String phoneNumber, BlockType blockType, OffsetDateTime blockedAt,
                         OffsetDateTime blockedUntil, int blockLevel, int consecutiveBlocks,
                         boolean active, boolean manuallyUnblocked, String unblockedBy,
                         OffsetDateTime unblockedAt, String unblockReason,
                         List<FailedAttemptSummary> failedAttempts, List<String> ipAddresses,
                         List<String> userAgents, List<String> deviceIds) {
        if (!blockedUntil.isAfter(blockedAt)) {
            throw new IllegalArgumentException("blockedUntil must be after blockedAt");
        }
        if (blockLevel < 1) {
            throw new IllegalArgumentException("blockLevel must be >= 1");
        }
        this.id = id;
        this.phoneNumber = phoneNumber;
        this.blockType = blockType;
        this.blockedAt = blockedAt;
        this.blockedUntil = blockedUntil;
        this.blockLevel = blockLevel;
        this.consecutiveBlocks = consecutiveBlocks;
        this.active = active;
        this.manuallyUnblocked = manuallyUnblocked;
        this.unblockedBy = unblockedBy;
        this.unblockedAt = unblockedAt;
        this.unblockReason = unblockReason;
        this.failedAttempts = failedAttempts == null ? List.of() : List.copyOf(failedAttempts);
        this.ipAddresses = ipAddresses == null ? List.of() : List.copyOf(ipAddresses);
        this.userAgents = userAgents == null ? List.of() : List.copyOf(userAgents);
        this.deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
    }

    /** New active block of the given level lasting {@code duration} from {@code now}. */
    public static SecurityBlock open(String phoneNumber, BlockType blockType, OffsetDateTime now, Duration duration,
                                     int blockLevel, int consecutiveBlocks, List<FailedAttemptSummary> failedAttempts,
                                     List<String> ipAddresses, List<String> userAgents, List<String> deviceIds) {
        return new SecurityBlock(UUID.randomUUID(), phoneNumber, blockType, now, now.plus(duration),
                blockLevel, consecutiveBlocks, true, false, null, null, null,
                failedAttempts, ipAddresses, userAgents, deviceIds);
    }

    // Business methods
    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(blockedUntil);
    }

    public boolean isInForce(OffsetDateTime now) {
        return active && !isExpired(now);
    }

    public long remainingSeconds(OffsetDateTime now) {
        return Math.max(0, Duration.between(now, blockedUntil).getSeconds());
    }

    /** Natural expiry: lifts the restriction without touching the escalation streak. */
    public void expire() {
        this.active = false;
    }

    /** Operator action: lifts the restriction and resets the escalation streak. */
    public void unblockManually(String operator, OffsetDateTime at, String reason) {
        this.active = false;
        this.manuallyUnblocked = true;
        this.unblockedBy = operator;
        this.unblockedAt = at;
        this.unblockReason = reason;
    }

    // Getters
    public UUID getId() { return id; }
    public String getPhoneNumber() { return phoneNumber; }
    public BlockType getBlockType() { return blockType; }
    public OffsetDateTime getBlockedAt() { return blockedAt; }
    public OffsetDateTime getBlockedUntil() { return blockedUntil; }
    public int getBlockLevel() { return blockLevel; }
    public int getConsecutiveBlocks() { return consecutiveBlocks; }
    public boolean isActive() { return active; }
    public boolean isManuallyUnblocked() { return manuallyUnblocked; }
    public String getUnblockedBy() { return unblockedBy; }
    public OffsetDateTime getUnblockedAt() { return unblockedAt; }
    public String getUnblockReason() { return unblockReason; }
    public List<FailedAttemptSummary> getFailedAttempts() { return failedAttempts; }
    public List<String> getIpAddresses() { return ipAddresses; }
    public List<String> getUserAgents() { return userAgents; }
    public List<String> getDeviceIds() { return deviceIds; }

    @Override
    public String toString() {
        return "SecurityBlock{" +
                "id=" + id +
                ", blockType=" + blockType +
                ", blockLevel=" + blockLevel +
                ", blockedUntil=" + blockedUntil +
                ", active=" + active +
                ", manuallyUnblocked=" + manuallyUnblocked +
                '}';
    }
}
