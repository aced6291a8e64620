// ==============================================================================
// Authentication Attempt JPA Entity
// File: src/main/java/com/gatekeeper/authgovernor/infrastructure/jpa/AttemptRecordEntity.java
// ==============================================================================

package com.gatekeeper.authgovernor.infrastructure.jpa;

import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "attempt_records", indexes = {
        @Index(name = "idx_attempt_phone_type_time", columnList = "phone_number, attempt_type, attempted_at"),
        @Index(name = "idx_attempt_time", columnList = "attempted_at")
})
public class AttemptRecordEntity {

    @Id
    private UUID id;

    @Column(name = "phone_number", nullable = false, length = 20, updatable = false)
    private String phoneNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "attempt_type", nullable = false, length = 20, updatable = false)
    private AttemptType attemptType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private AttemptResult result;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private OffsetDateTime attemptedAt;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "device_id", updatable = false)
    private String deviceId;

    @Column(name = "failure_reason", columnDefinition = "TEXT", updatable = false)
    private String failureReason;

    @Column(name = "related_block_id", updatable = false)
    private UUID relatedBlockId;

    public AttemptRecordEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }

    public AttemptType getAttemptType() { return attemptType; }
    public void setAttemptType(AttemptType attemptType) { this.attemptType = attemptType; }

    public AttemptResult getResult() { return result; }
    public void setResult(AttemptResult result) { this.result = result; }

    public OffsetDateTime getAttemptedAt() { return attemptedAt; }
    public void setAttemptedAt(OffsetDateTime attemptedAt) { this.attemptedAt = attemptedAt; }

    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

    public UUID getRelatedBlockId() { return relatedBlockId; }
    public void setRelatedBlockId(UUID relatedBlockId) { this.relatedBlockId = relatedBlockId; }
}
