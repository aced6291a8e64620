// ==============================================================================
// Device Session Domain Model
// File: src/main/java/com/gatekeeper/authgovernor/domain/device/DeviceSession.java
// ==============================================================================

package com.gatekeeper.authgovernor.domain.device;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A registered device for a user. The session token is not exposed here;
 * it only travels inside the issued bearer credential.
 */
public class DeviceSession {
    private final UUID id;
    private final UUID userId;
    private final String deviceId;
    private final String deviceName;
    private final String ipAddress;
    private final String userAgent;
    private final OffsetDateTime loggedInAt;
    private final OffsetDateTime lastUsedAt;
    private final boolean active;
    private final OffsetDateTime deactivatedAt;
    private final String deactivationReason;

    public DeviceSession(UUID id, UUID userId, String deviceId, String deviceName, String ipAddress,
                         String userAgent, OffsetDateTime loggedInAt, OffsetDateTime lastUsedAt,
                         boolean active, OffsetDateTime deactivatedAt, String deactivationReason) {
        this.id = id;
        this.userId = userId;
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.loggedInAt = loggedInAt;
        this.lastUsedAt = lastUsedAt;
        this.active = active;
        this.deactivatedAt = deactivatedAt;
        this.deactivationReason = deactivationReason;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public String getDeviceId() { return deviceId; }
    public String getDeviceName() { return deviceName; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public OffsetDateTime getLoggedInAt() { return loggedInAt; }
    public OffsetDateTime getLastUsedAt() { return lastUsedAt; }
    public boolean isActive() { return active; }
    public OffsetDateTime getDeactivatedAt() { return deactivatedAt; }
    public String getDeactivationReason() { return deactivationReason; }

    @Override
    public String toString() {
        return "DeviceSession{" +
                "id=" + id +
                ", userId=" + userId +
                ", deviceName='" + deviceName + '\'' +
                ", active=" + active +
                ", lastUsedAt=" + lastUsedAt +
                '}';
    }
}
