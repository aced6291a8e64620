package com.gatekeeper.authgovernor.application;

/**
 * Request metadata captured for auditing and device identity.
 */
public record ClientContext(String ipAddress, String userAgent, String deviceId, String deviceName) {
}
