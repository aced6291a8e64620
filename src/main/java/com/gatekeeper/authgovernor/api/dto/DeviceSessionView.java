package com.gatekeeper.authgovernor.api.dto;

import com.gatekeeper.authgovernor.domain.device.DeviceSession;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DeviceSessionView(
        UUID id,
        String deviceId,
        String deviceName,
        String ipAddress,
        String userAgent,
        OffsetDateTime loggedInAt,
        OffsetDateTime lastUsedAt,
        boolean active,
        OffsetDateTime deactivatedAt,
        String deactivationReason
) {

    public static DeviceSessionView from(DeviceSession s) {
        return new DeviceSessionView(s.getId(), s.getDeviceId(), s.getDeviceName(), s.getIpAddress(),
                s.getUserAgent(), s.getLoggedInAt(), s.getLastUsedAt(), s.isActive(), s.getDeactivatedAt(),
                s.getDeactivationReason());
    }
}
