package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.domain.UserType;
import org.springframework.security.core.AuthenticatedPrincipal;

import java.util.UUID;

/**
 * Caller identity taken from a verified bearer token.
 *
 * @param sessionToken device session claim, null for legacy or uncapped credentials
 */
public record GatewayPrincipal(UUID userId, String phoneNumber, UserType userType, String sessionToken)
        implements AuthenticatedPrincipal {

    @Override
    public String getName() {
        return phoneNumber;
    }

    @Override
    public String toString() {
        return "GatewayPrincipal{userId=" + userId + ", userType=" + userType + "}";
    }
}
