// ==============================================================================
// Authentication Attempt Domain Model
// File: src/main/java/com/gatekeeper/authgovernor/domain/AttemptRecord.java
// ==============================================================================

package com.gatekeeper.authgovernor.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One authentication try for a phone number. Written once and never updated.
 */
public class AttemptRecord {
    private final UUID id;
    private final String phoneNumber;
    private final AttemptType attemptType;
    private final AttemptResult result;
    private final OffsetDateTime attemptedAt;
    private final String ipAddress;
    private final String userAgent;
    private final String deviceId;
    private final String failureReason;
    private final UUID relatedBlockId;

    public AttemptRecord(UUID id, String phoneNumber, AttemptType attemptType, AttemptResult result,
                         OffsetDateTime attemptedAt, String ipAddress, String userAgent, String deviceId,
                         String failureReason, UUID relatedBlockId) {
        this.id = id;
        this.phoneNumber = phoneNumber;
        this.attemptType = attemptType;
        this.result = result;
        this.attemptedAt = attemptedAt;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.deviceId = deviceId;
        this.failureReason = failureReason;
        this.relatedBlockId = relatedBlockId;
    }

    public static AttemptRecord create(String phoneNumber, AttemptType attemptType, AttemptResult result,
                                       OffsetDateTime attemptedAt, String ipAddress, String userAgent,
                                       String deviceId, String failureReason, UUID relatedBlockId) {
        return new AttemptRecord(UUID.randomUUID(), phoneNumber, attemptType, result, attemptedAt,
                ipAddress, userAgent, deviceId, failureReason, relatedBlockId);
    }

    public UUID getId() { return id; }
    public String getPhoneNumber() { return phoneNumber; }
    public AttemptType getAttemptType() { return attemptType; }
    public AttemptResult getResult() { return result; }
    public OffsetDateTime getAttemptedAt() { return attemptedAt; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public String getDeviceId() { return deviceId; }
    public String getFailureReason() { return failureReason; }
    public UUID getRelatedBlockId() { return relatedBlockId; }

    @Override
    public String toString() {
        return "AttemptRecord{" +
                "id=" + id +
                ", attemptType=" + attemptType +
                ", result=" + result +
                ", attemptedAt=" + attemptedAt +
                '}';
    }
}
