package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.application.ProgressiveBlockService;
import com.gatekeeper.authgovernor.config.JwtService;
import com.gatekeeper.authgovernor.domain.AttemptDecision;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.infrastructure.jpa.AttemptRecordEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import com.gatekeeper.authgovernor.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SecurityAdminControllerTest extends IntegrationTestSupport {

    private static final String BLOCKED_PHONE = "01012345678";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private ProgressiveBlockService blocking;

    private String adminToken;
    private UUID blockId;

    @BeforeEach
    void setUp() {
        UserEntity admin = createUser("01000000001", "Admin-pass1", UserType.STAFF, "ADMIN");
        adminToken = "Bearer " + jwtService.generateToken(admin.getPhoneNumber(), admin.getId(),
                Set.of("ADMIN"), UserType.STAFF, null);

        AttemptDecision decision = null;
        for (int i = 0; i < 3; i++) {
            decision = blocking.recordAttempt(BLOCKED_PHONE, AttemptType.LOGIN, false, "203.0.113.7",
                    "JUnit", "device-x", "wrong password");
        }
        blockId = decision.getBlockInfo().blockId();
        blocking.recordAttempt("01099999999", AttemptType.LOGIN, true, "198.51.100.1", "JUnit", null, null);
    }

    @Test
    void nonAdminIsForbidden() throws Exception {
        UserEntity teacher = createUser("01022222222", "Teacher-pass1", UserType.TEACHER, "TEACHER");
        String token = jwtService.generateToken(teacher.getPhoneNumber(), teacher.getId(), Set.of("TEACHER"),
                UserType.TEACHER, null);

        mockMvc.perform(get("/admin/security/blocks").header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/admin/security/blocks"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(username = "ops", roles = "ADMIN")
    void sessionAuthenticatedAdminCanReadStats() throws Exception {
        mockMvc.perform(get("/admin/security/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeBlocks").value(1));
    }

    @Test
    void listsAndFiltersBlocks() throws Exception {
        mockMvc.perform(get("/admin/security/blocks").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].phoneNumber").value(BLOCKED_PHONE))
                .andExpect(jsonPath("$.content[0].inForce").value(true))
                .andExpect(jsonPath("$.content[0].ipAddresses[0]").value("203.0.113.7"));

        mockMvc.perform(get("/admin/security/blocks").param("isActive", "false").header("Authorization", adminToken))
                .andExpect(jsonPath("$.totalElements").value(0));
        mockMvc.perform(get("/admin/security/blocks").param("search", "2345").header("Authorization", adminToken))
                .andExpect(jsonPath("$.totalElements").value(1));
        mockMvc.perform(get("/admin/security/blocks").param("blockType", "PASSWORD_RESET").header("Authorization", adminToken))
                .andExpect(jsonPath("$.totalElements").value(0));
    }

    @Test
    void rejectsUnknownBlockType() throws Exception {
        mockMvc.perform(get("/admin/security/blocks").param("blockType", "EVERYTHING").header("Authorization", adminToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getsSingleBlock() throws Exception {
        mockMvc.perform(get("/admin/security/blocks/{id}", blockId).header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blockLevel").value(1))
                .andExpect(jsonPath("$.failedAttempts", hasSize(3)));

        mockMvc.perform(get("/admin/security/blocks/{id}", UUID.randomUUID()).header("Authorization", adminToken))
                .andExpect(status().isNotFound());
    }

    @Test
    void unblockLiftsActiveBlocksOnce() throws Exception {
        String body = "{\"phoneNumber\":\"" + BLOCKED_PHONE + "\",\"reason\":\"Verified by phone\"}";

        mockMvc.perform(post("/admin/security/unblock").header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unblockedCount").value(1));

        mockMvc.perform(get("/admin/security/blocks/{id}", blockId).header("Authorization", adminToken))
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.manuallyUnblocked").value(true))
                .andExpect(jsonPath("$.unblockedBy").value("01000000001"))
                .andExpect(jsonPath("$.unblockReason").value("Verified by phone"));

        mockMvc.perform(post("/admin/security/unblock").header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());
    }

    @Test
    void deactivateSingleBlock() throws Exception {
        mockMvc.perform(post("/admin/security/blocks/{id}/deactivate", blockId).header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"reason\":\"False positive\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.unblockReason").value("False positive"));

        mockMvc.perform(post("/admin/security/blocks/{id}/deactivate", blockId).header("Authorization", adminToken))
                .andExpect(status().isConflict());
    }

    @Test
    void searchesAttempts() throws Exception {
        mockMvc.perform(get("/admin/security/attempts").header("Authorization", adminToken)
                        .param("phoneNumber", BLOCKED_PHONE)
                        .param("result", "FAILED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(3))
                .andExpect(jsonPath("$.content[0].failureReason").value("wrong password"));

        mockMvc.perform(get("/admin/security/attempts").header("Authorization", adminToken)
                        .param("dateFrom", "2026-01-05")
                        .param("dateTo", "2026-01-05"))
                .andExpect(jsonPath("$.totalElements").value(4));

        mockMvc.perform(get("/admin/security/attempts").header("Authorization", adminToken)
                        .param("dateFrom", "2026-01-06"))
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(get("/admin/security/attempts").header("Authorization", adminToken)
                        .param("search", "198.51.100"))
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].result").value("SUCCESS"));
    }

    @Test
    void getsSingleAttempt() throws Exception {
        AttemptRecordEntity attempt = attemptRepository
                .findByPhoneNumberOrderByAttemptedAtDesc(BLOCKED_PHONE, PageRequest.of(0, 1)).get(0);

        mockMvc.perform(get("/admin/security/attempts/{id}", attempt.getId()).header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value(BLOCKED_PHONE))
                .andExpect(jsonPath("$.result").value(AttemptResult.FAILED.name()));
    }

    @Test
    void reportsStatistics() throws Exception {
        mockMvc.perform(get("/admin/security/stats").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBlocks").value(1))
                .andExpect(jsonPath("$.activeBlocks").value(1))
                .andExpect(jsonPath("$.blocksToday").value(1))
                .andExpect(jsonPath("$.totalAttempts").value(4))
                .andExpect(jsonPath("$.failedAttemptsToday").value(3))
                .andExpect(jsonPath("$.topBlockedNumbersThisWeek[0].phoneNumber").value(BLOCKED_PHONE))
                .andExpect(jsonPath("$.blockTypeDistributionThisWeek.LOGIN").value(1));
    }

    @Test
    void showsPhoneHistory() throws Exception {
        mockMvc.perform(get("/admin/security/phones/{phone}/history", BLOCKED_PHONE).header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isBlocked").value(true))
                .andExpect(jsonPath("$.currentBlock.blockLevel").value(1))
                .andExpect(jsonPath("$.statistics.failedAttempts").value(3))
                .andExpect(jsonPath("$.statistics.totalBlocks").value(1))
                .andExpect(jsonPath("$.recentAttempts", hasSize(3)));

        clock.advanceMinutes(16);

        mockMvc.perform(get("/admin/security/phones/{phone}/history", BLOCKED_PHONE).header("Authorization", adminToken))
                .andExpect(jsonPath("$.isBlocked").value(false))
                .andExpect(jsonPath("$.statistics.activeBlocks").value(0));
    }
}
