package com.gatekeeper.authgovernor.domain.device;

import java.util.List;
import java.util.UUID;

public record DeviceCapUpdate(UUID userId, int maxAllowedDevices, long activeSessions,
                              List<DeviceSession> deactivated) {
}
