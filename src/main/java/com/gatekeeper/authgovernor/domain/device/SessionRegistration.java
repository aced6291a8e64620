package com.gatekeeper.authgovernor.domain.device;

import java.util.List;

/**
 * Result of registering a login on a device.
 *
 * @param session      the active session after registration
 * @param sessionToken opaque value to embed in the bearer credential
 * @param reused       true when an existing row for the same device identity was refreshed
 * @param evicted      sessions deactivated to make room
 */
public record SessionRegistration(DeviceSession session, String sessionToken, boolean reused,
                                  List<DeviceSession> evicted) {
}
