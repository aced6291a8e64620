// ==============================================================================
// Security Block JPA Entity
// File: src/main/java/com/gatekeeper/authgovernor/infrastructure/jpa/SecurityBlockEntity.java
// ==============================================================================

package com.gatekeeper.authgovernor.infrastructure.jpa;

import com.gatekeeper.authgovernor.domain.BlockType;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "blocks", indexes = {
        @Index(name = "idx_block_phone_active", columnList = "phone_number, is_active"),
        @Index(name = "idx_block_phone_type_time", columnList = "phone_number, block_type, blocked_at")
})
public class SecurityBlockEntity {

    @Id
    private UUID id;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "block_type", nullable = false, length = 20)
    private BlockType blockType;

    @Column(name = "blocked_at", nullable = false)
    private OffsetDateTime blockedAt;

    @Column(name = "blocked_until", nullable = false)
    private OffsetDateTime blockedUntil;

    @Column(name = "block_level", nullable = false)
    private int blockLevel;

    @Column(name = "consecutive_blocks", nullable = false)
    private int consecutiveBlocks;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "manually_unblocked", nullable = false)
    private boolean manuallyUnblocked;

    @Column(name = "unblocked_by", length = 150)
    private String unblockedBy;

    @Column(name = "unblocked_at")
    private OffsetDateTime unblockedAt;

    @Column(name = "unblock_reason", columnDefinition = "TEXT")
    private String unblockReason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "failed_attempts")
    private List<Map<String, String>> failedAttempts = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ip_addresses")
    private List<String> ipAddresses = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "user_agents")
    private List<String> userAgents = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_ids")
    private List<String> deviceIds = new ArrayList<>();

    public SecurityBlockEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }

    public BlockType getBlockType() { return blockType; }
    public void setBlockType(BlockType blockType) { this.blockType = blockType; }

    public OffsetDateTime getBlockedAt() { return blockedAt; }
    public void setBlockedAt(OffsetDateTime blockedAt) { this.blockedAt = blockedAt; }

    public OffsetDateTime getBlockedUntil() { return blockedUntil; }
    public void setBlockedUntil(OffsetDateTime blockedUntil) { this.blockedUntil = blockedUntil; }

    public int getBlockLevel() { return blockLevel; }
    public void setBlockLevel(int blockLevel) { this.blockLevel = blockLevel; }

    public int getConsecutiveBlocks() { return consecutiveBlocks; }
    public void setConsecutiveBlocks(int consecutiveBlocks) { this.consecutiveBlocks = consecutiveBlocks; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isManuallyUnblocked() { return manuallyUnblocked; }
    public void setManuallyUnblocked(boolean manuallyUnblocked) { this.manuallyUnblocked = manuallyUnblocked; }

    public String getUnblockedBy() { return unblockedBy; }
    public void setUnblockedBy(String unblockedBy) { this.unblockedBy = unblockedBy; }

    public OffsetDateTime getUnblockedAt() { return unblockedAt; }
    public void setUnblockedAt(OffsetDateTime unblockedAt) { this.unblockedAt = unblockedAt; }

    public String getUnblockReason() { return unblockReason; }
    public void setUnblockReason(String unblockReason) { this.unblockReason = unblockReason; }

    public List<Map<String, String>> getFailedAttempts() { return failedAttempts; }
    public void setFailedAttempts(List<Map<String, String>> failedAttempts) { this.failedAttempts = failedAttempts; }

    public List<String> getIpAddresses() { return ipAddresses; }
    public void setIpAddresses(List<String> ipAddresses) { this.ipAddresses = ipAddresses; }

    public List<String> getUserAgents() { return userAgents; }
    public void setUserAgents(List<String> userAgents) { this.userAgents = userAgents; }

    public List<String> getDeviceIds() { return deviceIds; }
    public void setDeviceIds(List<String> deviceIds) { this.deviceIds = deviceIds; }
}
