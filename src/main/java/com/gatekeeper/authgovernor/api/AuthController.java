// ==============================================================================
// AuthController.java - Login, password reset and own-device endpoints
// File: src/main/java/com/gatekeeper/authgovernor/api/AuthController.java
// ==============================================================================

package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.api.dto.DeviceSessionView;
import com.gatekeeper.authgovernor.api.dto.LoginRequest;
import com.gatekeeper.authgovernor.api.dto.PasswordResetConfirmRequest;
import com.gatekeeper.authgovernor.api.dto.PasswordResetRequest;
import com.gatekeeper.authgovernor.application.AuthenticationService;
import com.gatekeeper.authgovernor.application.AuthenticationService.LoginResult;
import com.gatekeeper.authgovernor.application.ClientContext;
import com.gatekeeper.authgovernor.application.DeviceSessionService;
import com.gatekeeper.authgovernor.config.GatewayPrincipal;
import com.gatekeeper.authgovernor.domain.device.DeviceSession;
import com.gatekeeper.authgovernor.domain.device.SessionRegistration;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Phone-number login guarded by progressive blocking and device caps")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthenticationService authentication;
    private final DeviceSessionService devices;

    public AuthController(AuthenticationService authentication, DeviceSessionService devices) {
        this.authentication = authentication;
        this.devices = devices;
    }

    @PostMapping("/login")
    @Operation(
            summary = "Authenticate with phone number and password",
            description = """
        Checks for an active block on the number before verifying credentials.
        
        - A wrong password returns `401` with `remainingAttempts`.
        - Crossing the failure threshold, or calling while blocked, returns `429` with `Retry-After`.
        - For capped accounts (students) the token is bound to a device session. Signing in on a
          new device when the cap is reached signs out the least recently used device.
        """
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Authentication successful",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "Student login",
                                    value = """
                        {
                            "accessToken": "eyJhbGciOiJIUzI1NiJ9...",
                            "tokenType": "Bearer",
                            "expiresInSeconds": 3600,
                            "user": {
                                "id": "6f1c2a8e-4b7d-4f4e-9a51-2c3d4e5f6a7b",
                                "phoneNumber": "01012345678",
                                "userType": "STUDENT",
                                "roles": ["STUDENT"]
                            },
                            "device": {
                                "sessionId": "0b4f5c7e-1d2a-4e3b-8c9d-0e1f2a3b4c5d",
                                "deviceName": "Android Device",
                                "reused": false,
                                "evictedSessions": 1
                            }
                        }
                        """
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "401",
                    description = "Invalid credentials",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                        {
                            "status": 401,
                            "error": "Unauthorized",
                            "message": "Invalid phone number or password",
                            "code": "invalid_credentials",
                            "remainingAttempts": 2
                        }
                        """
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "429",
                    description = "Number is temporarily blocked",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                        {
                            "status": 429,
                            "error": "Too Many Requests",
                            "code": "blocked",
                            "block_level": 1,
                            "blocked_until": "2026-01-01T10:15:00Z",
                            "remaining_seconds": 900,
                            "remaining_time_formatted": "15 دقيقة",
                            "message_en": "Login attempts for this number are temporarily blocked..."
                        }
                        """
                            )
                    )
            )
    })
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        ClientContext client = ClientMetadata.from(request, req.deviceId(), req.deviceName());
        LoginResult result = authentication.login(req.phoneNumber(), req.password(), client);

        Map<String, Object> user = new LinkedHashMap<>();
        user.put("id", result.userId());
        user.put("phoneNumber", result.phoneNumber());
        user.put("fullName", result.fullName());
        user.put("userType", result.userType());
        user.put("roles", result.roles());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accessToken", result.accessToken());
        body.put("tokenType", "Bearer");
        body.put("expiresInSeconds", result.expiresInSeconds());
        body.put("user", user);

        SessionRegistration registration = result.session();
        if (registration != null) {
            Map<String, Object> device = new LinkedHashMap<>();
            device.put("sessionId", registration.session().getId());
            device.put("deviceName", registration.session().getDeviceName());
            device.put("reused", registration.reused());
            device.put("evictedSessions", registration.evicted().size());
            body.put("device", device);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/password-reset/request")
    @Operation(summary = "Request a password reset code",
            description = "Always answers with the same message whether or not the number is registered. Returns `429` while blocked.")
    public ResponseEntity<?> requestPasswordReset(@Valid @RequestBody PasswordResetRequest req, HttpServletRequest request) {
        String message = authentication.requestPasswordReset(req.phoneNumber(), ClientMetadata.from(request, null, null));
        return ResponseEntity.ok(Map.of("message", message));
    }

    @PostMapping("/password-reset/confirm")
    @Operation(summary = "Set a new password using the reset code",
            description = "Wrong or expired codes count as failed password-reset attempts and escalate to blocks like logins do.")
    public ResponseEntity<?> confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest req,
                                                  HttpServletRequest request) {
        authentication.confirmPasswordReset(req.phoneNumber(), req.code(), req.newPassword(),
                ClientMetadata.from(request, null, null));
        return ResponseEntity.ok(Map.of("message", "Password has been reset. Please sign in with the new password."));
    }

    @GetMapping("/whoami")
    @Operation(summary = "Describe the current caller")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<?> whoami(@AuthenticationPrincipal GatewayPrincipal principal, Authentication auth) {
        Set<String> roles = auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toCollection(TreeSet::new));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", principal.userId());
        body.put("phoneNumber", principal.phoneNumber());
        body.put("userType", principal.userType());
        body.put("roles", roles);
        body.put("deviceBound", principal.sessionToken() != null);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/devices")
    @Operation(summary = "List the caller's active device sessions")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<?> myDevices(@AuthenticationPrincipal GatewayPrincipal principal) {
        List<DeviceSessionView> sessions = devices.listSessions(principal.userId(), true).stream()
                .map(DeviceSessionView::from)
                .toList();
        UUID currentSessionId = devices.findActiveByToken(principal.userId(), principal.sessionToken())
                .map(DeviceSession::getId)
                .orElse(null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("maxAllowedDevices", devices.getDeviceCap(principal.userId()));
        body.put("capped", devices.isCapped(principal.userType()));
        body.put("currentSessionId", currentSessionId);
        body.put("sessions", sessions);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/logout")
    @Operation(summary = "Sign out the device bound to the presented token")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<?> logout(@AuthenticationPrincipal GatewayPrincipal principal) {
        if (principal.sessionToken() == null) {
            return ResponseEntity.ok(Map.of("loggedOut", false,
                    "message", "This token is not bound to a device session"));
        }
        boolean loggedOut = devices.logout(principal.userId(), principal.sessionToken());
        log.info("Logout for user {}: {}", principal.userId(), loggedOut);
        return ResponseEntity.ok(Map.of("loggedOut", loggedOut));
    }
}
