package com.hrms.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrms.backend.modules.auth.application.AuthNotificationSender;
import com.hrms.backend.modules.auth.domain.OtpPurpose;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.support.AbstractIntegrationTest;
import com.hrms.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractIntegrationTest {

    private static final String PASSWORD = "Employee#Pass1";
    private static final String ADMIN_EMAIL = "admin@hrms.test";
    private static final String ADMIN_PASSWORD = "Admin#Pass123";
    private static final AtomicInteger IP_SEQUENCE = new AtomicInteger(1);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @MockBean
    private AuthNotificationSender notificationSender;

    @Test
    void loginReturnsTokensAndProfile() throws Exception {
        String email = newEmployee();

        JsonNode response = login(email, PASSWORD, nextIp());

        assertThat(response.path("requiresTwoFactor").asBoolean()).isFalse();
        assertThat(response.path("tokens").path("tokenType").asText()).isEqualTo("Bearer");
        assertThat(response.path("tokens").path("expiresIn").asLong()).isEqualTo(900);
        assertThat(response.path("user").path("roles"))
                .anyMatch(node -> node.asText().equals("employee"));

        mockMvc.perform(get("/profile/me").header("Authorization", bearer(response)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email));
    }

    @Test
    void logoutRevokesAccessTokenImmediately() throws Exception {
        JsonNode session = login(newEmployee(), PASSWORD, nextIp());

        mockMvc.perform(post("/auth/logout").header("Authorization", bearer(session)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/profile/me").header("Authorization", bearer(session)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_REVOKED"));
        refresh(session.path("tokens").path("refreshToken").asText())
                .andExpect(status().isUnauthorized());
    }

    @Test
    void refreshRotatesAndRejectsReplay() throws Exception {
        JsonNode session = login(newEmployee(), PASSWORD, nextIp());
        String original = session.path("tokens").path("refreshToken").asText();

        JsonNode rotated = objectMapper.readTree(refresh(original)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());

        assertThat(rotated.path("refreshToken").asText()).isNotEqualTo(original);
        assertThat(rotated.path("sessionId").asText())
                .isNotEqualTo(session.path("tokens").path("sessionId").asText());

        refresh(original)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_REVOKED"));
    }

    @Test
    void accessTokenIsNotAcceptedForRefresh() throws Exception {
        JsonNode session = login(newEmployee(), PASSWORD, nextIp());

        refresh(session.path("tokens").path("accessToken").asText())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID"));
    }

    @Test
    void repeatedFailuresLockTheAccount() throws Exception {
        String email = newEmployee();
        String ip = nextIp();
        for (int i = 0; i < 5; i++) {
            loginRequest(email, "Wrong#Pass1", ip)
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        }

        loginRequest(email, PASSWORD, ip)
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value("ACCOUNT_LOCKED"));
    }

    @Test
    void unknownAccountGetsSameAnswerAsWrongPassword() throws Exception {
        loginRequest("nobody-" + UUID.randomUUID() + "@hrms.test", PASSWORD, nextIp())
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void twoFactorLoginRequiresEmailedCode() throws Exception {
        String email = newEmployee();
        testUserFactory.enableTwoFactor(email);
        String ip = nextIp();

        JsonNode challenge = login(email, PASSWORD, ip);

        assertThat(challenge.path("requiresTwoFactor").asBoolean()).isTrue();
        assertThat(challenge.has("tokens")).isFalse();
        assertThat(challenge.path("challenge").path("destination").asText()).endsWith("@hrms.test").contains("***");

        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(notificationSender).sendOtp(eq(email), eq(OtpPurpose.TWO_FACTOR), code.capture(), any());

        String body = """
                {"email": "%s", "code": "%s"}
                """.formatted(email, code.getValue());
        mockMvc.perform(post("/auth/2fa/verify")
                        .header("X-Forwarded-For", ip)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty());

        mockMvc.perform(post("/auth/2fa/verify")
                        .header("X-Forwarded-For", ip)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("OTP_EXPIRED"));
    }

    @Test
    void adminEndpointsRequirePermission() throws Exception {
        String email = newEmployee();
        JsonNode employee = login(email, PASSWORD, nextIp());
        String userId = employee.path("user").path("userId").asText();
        String body = """
                {"role": "manager"}
                """;

        mockMvc.perform(post("/admin/users/{id}/roles", userId)
                        .header("Authorization", bearer(employee))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));

        JsonNode admin = login(ADMIN_EMAIL, ADMIN_PASSWORD, nextIp());
        mockMvc.perform(post("/admin/users/{id}/roles", userId)
                        .header("Authorization", bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isNoContent());

        JsonNode profile = objectMapper.readTree(mockMvc.perform(get("/profile/me")
                        .header("Authorization", bearer(employee)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
        assertThat(profile.path("roles")).anyMatch(node -> node.asText().equals("manager"));
    }

    @Test
    void adminCanRevokeEverySessionOfAUser() throws Exception {
        String email = newEmployee();
        JsonNode first = login(email, PASSWORD, nextIp());
        JsonNode second = login(email, PASSWORD, nextIp());
        String userId = first.path("user").path("userId").asText();
        JsonNode admin = login(ADMIN_EMAIL, ADMIN_PASSWORD, nextIp());

        mockMvc.perform(post("/admin/users/{id}/sessions/revoke", userId)
                        .header("Authorization", bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revokedSessions").value(2));

        mockMvc.perform(get("/profile/me").header("Authorization", bearer(first)))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/profile/me").header("Authorization", bearer(second)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void weakNewPasswordListsEveryViolation() throws Exception {
        JsonNode session = login(newEmployee(), PASSWORD, nextIp());

        mockMvc.perform(post("/auth/password/change")
                        .header("Authorization", bearer(session))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"currentPassword": "%s", "newPassword": "short"}
                                """.formatted(PASSWORD)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("PASSWORD_POLICY_VIOLATION"))
                .andExpect(jsonPath("$.violations.length()").value(4));
    }

    @Test
    void protectedEndpointWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/profile/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    private String newEmployee() {
        String email = "employee-" + UUID.randomUUID() + "@hrms.test";
        UserAccount user = testUserFactory.ensureUser(email, PASSWORD, "employee");
        return user.getEmail();
    }

    private JsonNode login(String email, String password, String ip) throws Exception {
        String content = loginRequest(email, password, ip)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(content);
    }

    private ResultActions loginRequest(String email, String password, String ip) throws Exception {
        return mockMvc.perform(post("/auth/login")
                .header("X-Forwarded-For", ip)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email": "%s", "password": "%s"}
                        """.formatted(email, password)));
    }

    private ResultActions refresh(String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/refresh")
                .header("X-Forwarded-For", nextIp())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refreshToken": "%s"}
                        """.formatted(refreshToken)));
    }

    private static String bearer(JsonNode loginResponse) {
        return "Bearer " + loginResponse.path("tokens").path("accessToken").asText();
    }

    private static String nextIp() {
        int n = IP_SEQUENCE.getAndIncrement();
        return "198.51." + (n / 250) + "." + (n % 250 + 1);
    }
}
