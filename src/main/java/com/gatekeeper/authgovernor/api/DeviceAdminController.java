// ==============================================================================
// DeviceAdminController.java - Operator control over a user's device sessions
// File: src/main/java/com/gatekeeper/authgovernor/api/DeviceAdminController.java
// ==============================================================================

package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.api.dto.DeviceSessionView;
import com.gatekeeper.authgovernor.api.dto.MaxDevicesRequest;
import com.gatekeeper.authgovernor.application.DeviceSessionService;
import com.gatekeeper.authgovernor.domain.device.DeviceCapUpdate;
import com.gatekeeper.authgovernor.domain.device.DeviceSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/admin/users/{userId}/devices")
@PreAuthorize("hasRole('ADMIN')")
@SecurityRequirement(name = "Bearer Authentication")
@Tag(name = "Device Administration", description = "List, revoke and cap a user's device sessions")
public class DeviceAdminController {

    private static final Logger log = LoggerFactory.getLogger(DeviceAdminController.class);

    private final DeviceSessionService devices;

    public DeviceAdminController(DeviceSessionService devices) {
        this.devices = devices;
    }

    @GetMapping
    @Operation(summary = "List device sessions", description = "Most recently used first. Pass `activeOnly=false` to include ended sessions.")
    public ResponseEntity<?> list(@PathVariable UUID userId,
                                  @RequestParam(defaultValue = "true") boolean activeOnly) {
        List<DeviceSessionView> sessions = devices.listSessions(userId, activeOnly).stream()
                .map(DeviceSessionView::from)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("maxAllowedDevices", devices.getDeviceCap(userId));
        body.put("activeSessions", devices.countActive(userId));
        body.put("sessions", sessions);
        return ResponseEntity.ok(body);
    }

    @PutMapping("/max-devices")
    @Operation(summary = "Change the device cap",
            description = "Lowering the cap below the active count signs out the least recently used devices.")
    public ResponseEntity<?> setMaxDevices(@PathVariable UUID userId,
                                           @Valid @RequestBody MaxDevicesRequest req,
                                           Authentication auth) {
        DeviceCapUpdate update = devices.setDeviceCap(userId, req.maxAllowedDevices());
        log.info("👮 {} set device cap of user {} to {}", auth.getName(), userId, req.maxAllowedDevices());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", update.userId());
        body.put("maxAllowedDevices", update.maxAllowedDevices());
        body.put("activeSessions", update.activeSessions());
        body.put("deactivatedSessions", update.deactivated().stream().map(DeviceSessionView::from).toList());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Revoke one device session", description = "Revoking an already ended session is a no-op.")
    public ResponseEntity<DeviceSessionView> revoke(@PathVariable UUID userId, @PathVariable UUID sessionId) {
        DeviceSession revoked = devices.revoke(userId, sessionId);
        return ResponseEntity.ok(DeviceSessionView.from(revoked));
    }

    @PostMapping("/revoke-all")
    @Operation(summary = "Sign the user out of every device")
    public ResponseEntity<?> revokeAll(@PathVariable UUID userId, Authentication auth) {
        int count = devices.revokeAll(userId);
        log.info("👮 {} revoked all {} session(s) of user {}", auth.getName(), count, userId);
        return ResponseEntity.ok(Map.of("userId", userId, "revokedCount", count));
    }
}
