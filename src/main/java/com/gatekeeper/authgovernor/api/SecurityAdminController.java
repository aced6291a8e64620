// ==============================================================================
// SecurityAdminController.java - Operator view over blocks and attempt history
// File: src/main/java/com/gatekeeper/authgovernor/api/SecurityAdminController.java
// ==============================================================================

package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.api.dto.AttemptView;
import com.gatekeeper.authgovernor.api.dto.BlockView;
import com.gatekeeper.authgovernor.api.dto.DeactivateBlockRequest;
import com.gatekeeper.authgovernor.api.dto.UnblockRequest;
import com.gatekeeper.authgovernor.application.ProgressiveBlockService;
import com.gatekeeper.authgovernor.application.SecurityReportService;
import com.gatekeeper.authgovernor.application.SecurityReportService.AttemptFilter;
import com.gatekeeper.authgovernor.application.SecurityReportService.BlockFilter;
import com.gatekeeper.authgovernor.application.SecurityReportService.PhoneHistory;
import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.BlockType;
import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.SecurityBlock;
import com.gatekeeper.authgovernor.exception.ResourceNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

@RestController
@RequestMapping("/admin/security")
@PreAuthorize("hasRole('ADMIN')")
@SecurityRequirement(name = "Bearer Authentication")
@Tag(name = "Security Administration", description = "Inspect and lift blocks, browse attempt history")
public class SecurityAdminController {

    private static final Logger log = LoggerFactory.getLogger(SecurityAdminController.class);

    private final ProgressiveBlockService blocking;
    private final SecurityReportService reports;
    private final Clock clock;

    public SecurityAdminController(ProgressiveBlockService blocking, SecurityReportService reports, Clock clock) {
        this.blocking = blocking;
        this.reports = reports;
        this.clock = clock;
    }

    // ===================================================================================
    // BLOCKS
    // ===================================================================================

    @GetMapping("/blocks")
    @Operation(summary = "List blocks", description = "Newest first. `search` matches the phone number or an IP address.")
    public ResponseEntity<?> listBlocks(
            @RequestParam(name = "isActive", required = false) Boolean isActive,
            @RequestParam(required = false) BlockType blockType,
            @RequestParam(required = false) String phoneNumber,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        Page<SecurityBlock> result = reports.searchBlocks(
                new BlockFilter(isActive, blockType, phoneNumber, search), page, size);
        OffsetDateTime now = OffsetDateTime.now(clock);
        return ResponseEntity.ok(pageBody(result, b -> BlockView.from(b, now)));
    }

    @GetMapping("/blocks/{blockId}")
    @Operation(summary = "Get one block with its evidence")
    public ResponseEntity<BlockView> getBlock(@PathVariable UUID blockId) {
        return ResponseEntity.ok(BlockView.from(reports.getBlock(blockId), OffsetDateTime.now(clock)));
    }

    @PostMapping("/unblock")
    @Operation(summary = "Lift every active block on a phone number",
            description = "The number's failure window restarts from this moment.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Blocks lifted"),
            @ApiResponse(responseCode = "404", description = "No active block for this number")
    })
    public ResponseEntity<?> unblock(@Valid @RequestBody UnblockRequest req, Authentication auth) {
        int count = blocking.manuallyUnblock(req.phoneNumber(), auth.getName(), req.reason());
        if (count == 0) {
            throw new ResourceNotFoundException("No active block for " + PhoneNumbers.mask(req.phoneNumber()));
        }
        log.info("👮 {} lifted {} block(s) on {}", auth.getName(), count, PhoneNumbers.mask(req.phoneNumber()));
        return ResponseEntity.ok(Map.of(
                "phoneNumber", req.phoneNumber(),
                "unblockedCount", count,
                "message", "Unblocked " + count + " active block(s)"));
    }

    @PostMapping("/blocks/{blockId}/deactivate")
    @Operation(summary = "Lift a single block")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Block lifted"),
            @ApiResponse(responseCode = "404", description = "Block not found"),
            @ApiResponse(responseCode = "409", description = "Block is already inactive")
    })
    public ResponseEntity<BlockView> deactivate(@PathVariable UUID blockId,
                                                @Valid @RequestBody(required = false) DeactivateBlockRequest req,
                                                Authentication auth) {
        String reason = req != null ? req.reason() : null;
        SecurityBlock lifted = blocking.liftBlock(blockId, auth.getName(), reason);
        return ResponseEntity.ok(BlockView.from(lifted, OffsetDateTime.now(clock)));
    }

    // ===================================================================================
    // ATTEMPTS
    // ===================================================================================

    @GetMapping("/attempts")
    @Operation(summary = "List authentication attempts", description = "Newest first. Dates are inclusive calendar days in UTC.")
    public ResponseEntity<?> listAttempts(
            @RequestParam(required = false) String phoneNumber,
            @RequestParam(required = false) AttemptType attemptType,
            @RequestParam(required = false) AttemptResult result,
            @Parameter(example = "2026-01-01")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @Parameter(example = "2026-01-31")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        Page<AttemptRecord> attempts = reports.searchAttempts(
                new AttemptFilter(phoneNumber, attemptType, result, dateFrom, dateTo, search), page, size);
        return ResponseEntity.ok(pageBody(attempts, AttemptView::from));
    }

    @GetMapping("/attempts/{attemptId}")
    @Operation(summary = "Get one attempt")
    public ResponseEntity<AttemptView> getAttempt(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(AttemptView.from(reports.getAttempt(attemptId)));
    }

    // ===================================================================================
    // REPORTS
    // ===================================================================================

    @GetMapping("/stats")
    @Operation(summary = "Dashboard counters", description = "Today and this week are measured in UTC.")
    public ResponseEntity<?> stats() {
        return ResponseEntity.ok(reports.stats());
    }

    @GetMapping("/phones/{phoneNumber}/history")
    @Operation(summary = "Full security history of one phone number")
    public ResponseEntity<?> phoneHistory(@PathVariable String phoneNumber) {
        PhoneHistory history = reports.phoneHistory(phoneNumber);
        OffsetDateTime now = OffsetDateTime.now(clock);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("totalAttempts", history.totalAttempts());
        statistics.put("successfulAttempts", history.successfulAttempts());
        statistics.put("failedAttempts", history.failedAttempts());
        statistics.put("blockedAttempts", history.blockedAttempts());
        statistics.put("totalBlocks", history.totalBlocks());
        statistics.put("activeBlocks", history.activeBlocks());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("phoneNumber", history.phoneNumber());
        body.put("isBlocked", history.currentBlock() != null);
        body.put("currentBlock", history.currentBlock());
        body.put("statistics", statistics);
        body.put("blocks", history.blocks().stream().map(b -> BlockView.from(b, now)).toList());
        body.put("recentAttempts", history.recentAttempts().stream().map(AttemptView::from).toList());
        return ResponseEntity.ok(body);
    }

    private static <T, V> Map<String, Object> pageBody(Page<T> page, Function<T, V> mapper) {
        List<V> content = page.getContent().stream().map(mapper).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        body.put("page", page.getNumber());
        body.put("size", page.getSize());
        body.put("totalElements", page.getTotalElements());
        body.put("totalPages", page.getTotalPages());
        return body;
    }
}
