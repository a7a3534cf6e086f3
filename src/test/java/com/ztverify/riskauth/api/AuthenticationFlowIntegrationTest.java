package com.ztverify.riskauth.api;

import com.jayway.jsonpath.JsonPath;
import com.ztverify.riskauth.domain.ports.OtpNotifierPort;
import com.ztverify.riskauth.infrastructure.jpa.SpringUserAccountRepository;
import com.ztverify.riskauth.infrastructure.jpa.UserAccountEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthenticationFlowIntegrationTest {

    private static final String PASSWORD = "correct-horse-battery";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private SpringUserAccountRepository accounts;

    @Autowired
    private PasswordEncoder encoder;

    @MockBean
    private OtpNotifierPort notifier;

    private String newUser(String status) {
        String username = "user-" + UUID.randomUUID().toString().substring(0, 8);
        UserAccountEntity account = new UserAccountEntity();
        account.setUsername(username);
        account.setEmail(username + "@example.com");
        account.setPasswordHash(encoder.encode(PASSWORD));
        account.setStatus(status);
        account.setRoles(Set.of("USER"));
        accounts.save(account);
        return username;
    }

    private static String loginJson(String username, String password, String country, int asn, String ip) {
        return """
                {"username": "%s", "password": "%s", "ip_address": "%s", "country_code": "%s", "asn": %d,
                 "user_agent": "Mozilla/5.0 (X11; Linux x86_64) Firefox/125.0",
                 "device_fingerprint": "fp-%s", "location": "Somewhere", "device_type": "desktop"}
                """.formatted(username, password, ip, country, asn, username);
    }

    private MvcResult authenticate(String json) throws Exception {
        return mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON).content(json))
                .andReturn();
    }

    private String capturedCode(String username) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(notifier, atLeastOnce()).send(eq(username + "@example.com"), code.capture(), eq(username));
        return code.getValue();
    }

    @Test
    void shouldAllowTrustedRegionLoginWithToken() throws Exception {
        String user = newUser("ACTIVE");

        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content(loginJson(user, PASSWORD, "AE", 5384, "94.200.1.1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("allow"))
                .andExpect(jsonPath("$.riskLevel").value("LOW"))
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.accessToken").isNotEmpty());
    }

    @Test
    void shouldDenyWrongPasswordWithoutDetail() throws Exception {
        String user = newUser("ACTIVE");

        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content(loginJson(user, "wrong-password", "AE", 5384, "94.200.1.1")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.decision").value("deny"))
                .andExpect(jsonPath("$.riskScore").doesNotExist())
                .andExpect(jsonPath("$.reason").value("invalid_credentials"));

        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content(loginJson("nobody-" + user, PASSWORD, "AE", 5384, "94.200.1.1")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("invalid_credentials"));
    }

    @Test
    void shouldDenyLockedAccount() throws Exception {
        String user = newUser("LOCKED");

        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content(loginJson(user, PASSWORD, "AE", 5384, "94.200.1.1")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldChallengeHighRiskLoginAndCompleteWithEmailedCode() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");

        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content(loginJson(user, PASSWORD, "RU", 0, "95.31.18.119")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("challenge"))
                .andExpect(jsonPath("$.riskScore").value(0.8))
                .andExpect(jsonPath("$.reason").value("high_risk"))
                .andExpect(jsonPath("$.challenge.expiresInSeconds").value(300))
                .andExpect(jsonPath("$.accessToken").doesNotExist());

        String code = capturedCode(user);
        MvcResult completed = mvc.perform(post("/api/otp/complete").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "%s", "code": "%s", "device_fingerprint": "fp-%s", "trust_device": true}
                                """.formatted(user, code, user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("allow"))
                .andExpect(jsonPath("$.deviceRegistered").value(true))
                .andReturn();

        String token = JsonPath.read(completed.getResponse().getContentAsString(), "$.accessToken");
        mvc.perform(get("/api/devices").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.devices[0].deviceFingerprint").value("fp-" + user));

        // The code is single use.
        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, code)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("ALREADY_VERIFIED"));
    }

    @Test
    void shouldReuseActiveChallengeAndRateLimitExplicitRequests() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");

        MvcResult first = authenticate(loginJson(user, PASSWORD, "CN", 0, "36.110.1.1"));
        MvcResult second = authenticate(loginJson(user, PASSWORD, "CN", 0, "36.110.1.1"));

        String firstId = JsonPath.read(first.getResponse().getContentAsString(), "$.challenge.challengeId");
        String secondId = JsonPath.read(second.getResponse().getContentAsString(), "$.challenge.challengeId");
        Boolean reused = JsonPath.read(second.getResponse().getContentAsString(), "$.challenge.reused");
        assertThat(secondId).isEqualTo(firstId);
        assertThat(reused).isTrue();

        mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\"}".formatted(user)))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("challenge_active"))
                .andExpect(jsonPath("$.remainingSeconds").isNumber());

        mvc.perform(get("/api/otp/status/" + user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.attemptsRemaining").value(3));
    }

    @Test
    void shouldCountDownWrongCodesAndRejectMalformedOnes() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");
        mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\"}".formatted(user)))
                .andExpect(status().isOk());
        String code = capturedCode(user);
        String wrong = code.equals("000000") ? "111111" : "000000";

        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, wrong)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("INVALID_CODE"))
                .andExpect(jsonPath("$.attemptsRemaining").value(2));

        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"12ab\"}".formatted(user)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed_code"));

        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, code)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        // A code consumed by /verify cannot also complete a login.
        mvc.perform(post("/api/otp/complete").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, code)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.decision").value("deny"))
                .andExpect(jsonPath("$.reason").value("ALREADY_VERIFIED"));
    }

    @Test
    void shouldNotLetAnonymousCallersResetAnActiveChallenge() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");
        mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\"}".formatted(user)))
                .andExpect(status().isOk());
        String code = capturedCode(user);
        String wrong = code.equals("000000") ? "111111" : "000000";
        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, wrong)))
                .andExpect(jsonPath("$.attemptsRemaining").value(2));

        mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"replaceActive\": true}".formatted(user)))
                .andExpect(status().isTooManyRequests());

        mvc.perform(get("/api/otp/status/" + user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attempts").value(1))
                .andExpect(jsonPath("$.attemptsRemaining").value(2));
        verify(notifier, times(1)).send(anyString(), anyString(), eq(user));
    }

    @Test
    void shouldAnswerCodeRequestsIdenticallyForUnknownUsers() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");

        MvcResult known = mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\"}".formatted(user)))
                .andExpect(status().isOk())
                .andReturn();
        MvcResult unknown = mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"no-such-user-42\"}"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(unknown.getResponse().getContentAsString()).isEqualTo(known.getResponse().getContentAsString());
        verify(notifier, never()).send(anyString(), anyString(), eq("no-such-user-42"));
    }

    @Test
    void shouldLetOnlyAdminsReissueAnActiveChallenge() throws Exception {
        when(notifier.send(anyString(), anyString(), anyString())).thenReturn(true);
        String user = newUser("ACTIVE");
        mvc.perform(post("/api/otp/request").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\"}".formatted(user)))
                .andExpect(status().isOk());

        MvcResult userLogin = authenticate(loginJson(user, PASSWORD, "AE", 5384, "94.200.1.1"));
        String userToken = JsonPath.read(userLogin.getResponse().getContentAsString(), "$.accessToken");
        mvc.perform(post("/admin/otp/" + user + "/reissue").header("Authorization", "Bearer " + userToken))
                .andExpect(status().isForbidden());

        MvcResult adminLogin = authenticate(loginJson("admin", "admin-password-123", "AE", 5384, "94.200.1.1"));
        String adminToken = JsonPath.read(adminLogin.getResponse().getContentAsString(), "$.accessToken");
        mvc.perform(post("/admin/otp/" + user + "/reissue").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresInSeconds").value(300));

        verify(notifier, times(2)).send(anyString(), anyString(), eq(user));
        mvc.perform(post("/api/otp/verify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"%s\", \"code\": \"%s\"}".formatted(user, capturedCode(user))))
                .andExpect(status().isOk());
    }

    @Test
    void shouldReportMissingChallenge() throws Exception {
        mvc.perform(get("/api/otp/status/nobody-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("no_challenge"));
    }

    @Test
    void shouldRestrictAuditToAdmins() throws Exception {
        String user = newUser("ACTIVE");
        MvcResult userLogin = authenticate(loginJson(user, PASSWORD, "AE", 5384, "94.200.1.1"));
        String userToken = JsonPath.read(userLogin.getResponse().getContentAsString(), "$.accessToken");

        mvc.perform(get("/admin/login-attempts/" + user))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/admin/login-attempts/" + user).header("Authorization", "Bearer " + userToken))
                .andExpect(status().isForbidden());

        MvcResult adminLogin = authenticate(loginJson("admin", "admin-password-123", "AE", 5384, "94.200.1.1"));
        String adminToken = JsonPath.read(adminLogin.getResponse().getContentAsString(), "$.accessToken");

        mvc.perform(get("/admin/login-attempts/" + user).header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.attempts[0].decision").value("allow"));
        mvc.perform(get("/admin/login-stats").param("days", "1").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").isNumber());
    }

    @Test
    void shouldRejectInvalidRequestBody() throws Exception {
        mvc.perform(post("/api/authenticate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"\", \"password\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
    }
}
