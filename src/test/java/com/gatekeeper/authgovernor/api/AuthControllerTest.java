package com.gatekeeper.authgovernor.api;

import com.gatekeeper.authgovernor.config.JwtService;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import com.gatekeeper.authgovernor.support.IntegrationTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerTest extends IntegrationTestSupport {

    private static final String STUDENT_PHONE = "01012345678";
    private static final String PASSWORD = "Secret-pass1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtService jwtService;

    private UserEntity student;

    @BeforeEach
    void createStudent() {
        student = createUser(STUDENT_PHONE, PASSWORD, UserType.STUDENT, "STUDENT");
    }

    private ResultActions login(String phone, String password, String deviceId) throws Exception {
        String device = deviceId == null ? "" : ",\"deviceId\":\"" + deviceId + "\"";
        return mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .header("User-Agent", "Mozilla/5.0 (Linux; Android 14)")
                .content("{\"phoneNumber\":\"" + phone + "\",\"password\":\"" + password + "\"" + device + "}"));
    }

    private String loginToken(String deviceId) throws Exception {
        String body = login(STUDENT_PHONE, PASSWORD, deviceId)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        clock.advanceMinutes(1);
        return JsonPath.read(body, "$.accessToken");
    }

    @Test
    void loginReturnsDeviceBoundToken() throws Exception {
        String body = login(STUDENT_PHONE, PASSWORD, "phone-1")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.user.userType").value("STUDENT"))
                .andExpect(jsonPath("$.device.deviceName").value("Android Device"))
                .andExpect(jsonPath("$.device.reused").value(false))
                .andExpect(jsonPath("$.device.evictedSessions").value(0))
                .andReturn().getResponse().getContentAsString();

        String token = JsonPath.read(body, "$.accessToken");
        assertThat(jwtService.getSessionToken(token)).isPresent();

        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value(STUDENT_PHONE))
                .andExpect(jsonPath("$.deviceBound").value(true));
    }

    @Test
    void uncappedUserTokenIsNotDeviceBound() throws Exception {
        createUser("01022222222", PASSWORD, UserType.TEACHER, "TEACHER");

        String body = login("01022222222", PASSWORD, "laptop")
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertThat(body).doesNotContain("\"device\"");
        assertThat(jwtService.getSessionToken(JsonPath.read(body, "$.accessToken"))).isEmpty();
        assertThat(sessionRepository.count()).isZero();
    }

    @Test
    void wrongPasswordReportsRemainingAttempts() throws Exception {
        login(STUDENT_PHONE, "wrong-pass", null)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("invalid_credentials"))
                .andExpect(jsonPath("$.remainingAttempts").value(2));
    }

    @Test
    void unknownNumberLooksLikeWrongPassword() throws Exception {
        login("01099999999", PASSWORD, null)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid phone number or password"))
                .andExpect(jsonPath("$.remainingAttempts").value(2));

        assertThat(attemptRepository.countByPhoneNumberAndResult("01099999999", AttemptResult.FAILED)).isEqualTo(1);
    }

    @Test
    void thirdFailureBlocksEvenCorrectPassword() throws Exception {
        login(STUDENT_PHONE, "wrong-pass", null).andExpect(status().isUnauthorized());
        login(STUDENT_PHONE, "wrong-pass", null).andExpect(status().isUnauthorized());
        login(STUDENT_PHONE, "wrong-pass", null)
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "900"))
                .andExpect(jsonPath("$.code").value("blocked"))
                .andExpect(jsonPath("$.block_type").value("LOGIN"))
                .andExpect(jsonPath("$.block_level").value(1))
                .andExpect(jsonPath("$.remaining_seconds").value(900));

        clock.advanceMinutes(1);
        login(STUDENT_PHONE, PASSWORD, null)
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.remaining_seconds").value(840));

        clock.advanceMinutes(15);
        login(STUDENT_PHONE, PASSWORD, null).andExpect(status().isOk());
    }

    @Test
    void evictedDeviceIsLoggedOutOnNextRequest() throws Exception {
        String tokenA = loginToken("A");
        String tokenB = loginToken("B");

        String bodyC = login(STUDENT_PHONE, PASSWORD, "C")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.device.evictedSessions").value(1))
                .andReturn().getResponse().getContentAsString();
        String tokenC = JsonPath.read(bodyC, "$.accessToken");

        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + tokenA))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("device_token_invalid"));
        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + tokenB))
                .andExpect(status().isOk());
        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + tokenC))
                .andExpect(status().isOk());
        assertThat(sessionRepository.countByUserIdAndActiveTrue(student.getId())).isEqualTo(2);
    }

    @Test
    void devicesListMarksCurrentSession() throws Exception {
        loginToken("A");
        String tokenB = loginToken("B");

        mockMvc.perform(get("/auth/devices").header("Authorization", "Bearer " + tokenB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxAllowedDevices").value(2))
                .andExpect(jsonPath("$.sessions", hasSize(2)))
                .andExpect(jsonPath("$.currentSessionId").isNotEmpty());
    }

    @Test
    void logoutInvalidatesToken() throws Exception {
        String token = loginToken("A");

        mockMvc.perform(post("/auth/logout").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loggedOut").value(true));

        clock.advanceMinutes(5);
        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("device_token_invalid"))
                .andExpect(jsonPath("$.timestamp").value(now().toString()));
    }

    @Test
    void legacyStudentTokenWithoutSessionClaimIsAccepted() throws Exception {
        String legacy = jwtService.generateToken(STUDENT_PHONE, student.getId(), Set.of("STUDENT"),
                UserType.STUDENT, null);

        mockMvc.perform(get("/auth/whoami").header("Authorization", "Bearer " + legacy))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceBound").value(false));
    }

    @Test
    void protectedEndpointRequiresToken() throws Exception {
        mockMvc.perform(get("/auth/whoami"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Valid Bearer token required"));
    }

    @Test
    void invalidLoginPayloadIsRejected() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"abc\",\"password\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.phoneNumber").exists())
                .andExpect(jsonPath("$.details.password").exists());

        assertThat(attemptRepository.count()).isZero();
    }

    @Test
    void passwordResetWithIssuedCode() throws Exception {
        mockMvc.perform(post("/auth/password-reset/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"" + STUDENT_PHONE + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", startsWith("If this number is registered")));

        String code = notifier.lastResetCode(STUDENT_PHONE).orElseThrow();
        mockMvc.perform(post("/auth/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"" + STUDENT_PHONE + "\",\"code\":\"" + code
                                + "\",\"newPassword\":\"Brand-new-pass2\"}"))
                .andExpect(status().isOk());

        login(STUDENT_PHONE, PASSWORD, "A").andExpect(status().isUnauthorized());
        login(STUDENT_PHONE, "Brand-new-pass2", "A").andExpect(status().isOk());
    }

    @Test
    void unknownNumberGetsSameResetReply() throws Exception {
        mockMvc.perform(post("/auth/password-reset/request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"01099999999\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", startsWith("If this number is registered")));

        assertThat(notifier.lastResetCode("01099999999")).isEmpty();
    }

    @Test
    void wrongResetCodesBlockPasswordResetButNotLogin() throws Exception {
        mockMvc.perform(post("/auth/password-reset/request")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phoneNumber\":\"" + STUDENT_PHONE + "\"}"));
        String issued = notifier.lastResetCode(STUDENT_PHONE).orElseThrow();
        String wrong = "000000".equals(issued) ? "111111" : "000000";
        String payload = "{\"phoneNumber\":\"" + STUDENT_PHONE + "\",\"code\":\"" + wrong
                + "\",\"newPassword\":\"Brand-new-pass2\"}";

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/auth/password-reset/confirm").contentType(MediaType.APPLICATION_JSON).content(payload))
                    .andExpect(status().isUnauthorized());
        }
        mockMvc.perform(post("/auth/password-reset/confirm").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.block_type").value("PASSWORD_RESET"));

        login(STUDENT_PHONE, PASSWORD, "A").andExpect(status().isOk());
    }

    @Test
    void expiredResetCodeIsRejected() throws Exception {
        mockMvc.perform(post("/auth/password-reset/request")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phoneNumber\":\"" + STUDENT_PHONE + "\"}"));
        String code = notifier.lastResetCode(STUDENT_PHONE).orElseThrow();

        clock.advanceMinutes(11);

        mockMvc.perform(post("/auth/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phoneNumber\":\"" + STUDENT_PHONE + "\",\"code\":\"" + code
                                + "\",\"newPassword\":\"Brand-new-pass2\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid or expired reset code"));
    }
}
