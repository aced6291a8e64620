package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.application.ClientContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Extracts caller IP, user agent and a display name for the device from a request.
 */
public final class ClientMetadata {

    static final String DEVICE_ID_HEADER = "X-Device-Id";
    static final String UNKNOWN_DEVICE = "Unknown Device";

    private ClientMetadata() {
    }

    public static ClientContext from(HttpServletRequest request, String deviceId, String deviceName) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        String effectiveDeviceId = StringUtils.hasText(deviceId) ? deviceId.trim() : request.getHeader(DEVICE_ID_HEADER);
        if (!StringUtils.hasText(effectiveDeviceId)) {
            effectiveDeviceId = null;
        }
        String name = StringUtils.hasText(deviceName) ? deviceName.trim() : deviceNameFrom(userAgent);
        return new ClientContext(clientIp(request), userAgent, effectiveDeviceId, name);
    }

    /** First hop of X-Forwarded-For when present, otherwise the socket address. */
    public static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    public static String deviceNameFrom(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return UNKNOWN_DEVICE;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (ua.contains("iphone")) {
            return "iPhone";
        }
        if (ua.contains("ipad")) {
            return "iPad";
        }
        if (ua.contains("android")) {
            return "Android Device";
        }
        if (ua.contains("windows")) {
            return "Windows PC";
        }
        if (ua.contains("macintosh") || ua.contains("mac os")) {
            return "Mac";
        }
        if (ua.contains("linux")) {
            return "Linux PC";
        }
        return userAgent.length() > 50 ? userAgent.substring(0, 50) : userAgent;
    }
}
