package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.application.DeviceSessionService;
import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.exception.SessionInvalidException;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Verifies the bearer token and, for capped user types, that its device session is
 * still active. A revoked or evicted session is rejected here with 401
 * {@code device_token_invalid} before any controller runs.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private final JwtService jwt;
    private final DeviceSessionService devices;
    private final Clock clock;

    public JwtAuthFilter(JwtService jwt, DeviceSessionService devices, Clock clock) {
        this.jwt = jwt;
        this.devices = devices;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();

        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }
        if (path.equals("/auth/login") || path.startsWith("/auth/password-reset/")) {
            return true;
        }
        if (path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui") || path.equals("/swagger-ui.html")) {
            return true;
        }
        return path.equals("/actuator/health") || path.equals("/actuator/info");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            log.debug("JwtAuthFilter: No bearer token for {} {}", method, path);
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7).trim();
        GatewayPrincipal principal;
        Set<SimpleGrantedAuthority> authorities;
        try {
            Claims claims = jwt.parse(token).getBody();
            Optional<UUID> userId = JwtService.userIdFrom(claims);
            if (claims.getSubject() == null || userId.isEmpty()) {
                log.warn("JwtAuthFilter: Token without subject or user id for {} {}", method, path);
                chain.doFilter(request, response);
                return;
            }
            UserType userType = JwtService.userTypeFrom(claims).orElse(null);
            String sessionToken = JwtService.sessionTokenFrom(claims).orElse(null);
            principal = new GatewayPrincipal(userId.get(), claims.getSubject(), userType, sessionToken);
            authorities = JwtService.rolesFrom(claims).stream()
                    .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role)
                    .map(SimpleGrantedAuthority::new)
                    .collect(Collectors.toSet());
        } catch (Exception e) {
            log.warn("JwtAuthFilter: Invalid or expired token for {} {}: {}", method, path, e.getMessage());
            SecurityContextHolder.clearContext();
            chain.doFilter(request, response);
            return;
        }

        if (devices.isCapped(principal.userType())) {
            try {
                checkDeviceSession(principal);
            } catch (SessionInvalidException e) {
                log.warn("JwtAuthFilter: Rejected {} {} for {} - {}", method, path,
                        PhoneNumbers.mask(principal.phoneNumber()), e.getMessage());
                SecurityContextHolder.clearContext();
                writeSessionInvalid(response, e.getMessage(), path);
                return;
            }
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, authorities);
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("JwtAuthFilter: Authenticated {} with authorities {} for {} {}",
                PhoneNumbers.mask(principal.phoneNumber()), authorities, method, path);

        chain.doFilter(request, response);
    }

    private void checkDeviceSession(GatewayPrincipal principal) {
        String sessionToken = principal.sessionToken();
        if (sessionToken == null) {
            if (devices.isLegacyTokenAllowed()) {
                log.debug("JwtAuthFilter: Legacy token without session claim accepted for user {}", principal.userId());
                return;
            }
            throw new SessionInvalidException("Session expired. Please sign in again.");
        }
        if (!devices.validateSession(principal.userId(), sessionToken)) {
            throw new SessionInvalidException();
        }
        devices.touch(sessionToken);
    }

    private void writeSessionInvalid(HttpServletResponse response, String message, String path) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(
                "{\"timestamp\":\"" + OffsetDateTime.now(clock) + "\"," +
                        "\"status\":401," +
                        "\"error\":\"Unauthorized\"," +
                        "\"code\":\"" + SessionInvalidException.CODE + "\"," +
                        "\"message\":\"" + message + "\"," +
                        "\"path\":\"" + path + "\"}"
        );
    }
}
