package com.ztverify.riskauth.api;

import com.ztverify.riskauth.api.dto.OtpCompleteRequest;
import com.ztverify.riskauth.api.dto.OtpRequest;
import com.ztverify.riskauth.api.dto.OtpVerifyRequest;
import com.ztverify.riskauth.application.AuthenticationDecisionService;
import com.ztverify.riskauth.application.ChallengeCompletion;
import com.ztverify.riskauth.application.CompleteChallengeCommand;
import com.ztverify.riskauth.application.OtpChallengeService;
import com.ztverify.riskauth.config.JwtService;
import com.ztverify.riskauth.domain.otp.OtpChallengeStatus;
import com.ztverify.riskauth.domain.otp.OtpVerificationResult;
import com.ztverify.riskauth.domain.otp.RemainingTime;
import com.ztverify.riskauth.domain.ports.CredentialVerifierPort;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/otp")
@Tag(name = "One-time passcodes", description = "Email OTP step-up for challenged logins")
public class OtpController {

    private static final Logger log = LoggerFactory.getLogger(OtpController.class);

    private final OtpChallengeService otp;
    private final AuthenticationDecisionService decisions;
    private final CredentialVerifierPort accounts;
    private final JwtService jwt;

    public OtpController(OtpChallengeService otp, AuthenticationDecisionService decisions,
                         CredentialVerifierPort accounts, JwtService jwt) {
        this.otp = otp;
        this.decisions = decisions;
        this.accounts = accounts;
        this.jwt = jwt;
    }

    @PostMapping("/request")
    @Operation(summary = "Send a new one-time code",
            description = "Rejected with 429 while a previous code is still valid. The response is the same "
                    + "whether or not the username exists.")
    public ResponseEntity<?> request(@Valid @RequestBody OtpRequest req) {
        otp.requestCode(req.username().trim());
        long lifetime = otp.getLifetimeSeconds();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "If the account can receive codes, a verification code has been sent");
        body.put("expiresInSeconds", lifetime);
        body.put("expiresIn", RemainingTime.format(lifetime));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/verify")
    @Operation(summary = "Check a one-time code without completing a login",
            description = "A correct code is consumed: the challenge is marked verified and a later "
                    + "`POST /api/otp/complete` with the same code answers `ALREADY_VERIFIED`. "
                    + "Clients finishing a challenged login should call `/complete` directly.")
    public ResponseEntity<?> verify(@Valid @RequestBody OtpVerifyRequest req) {
        OtpVerificationResult result = otp.verify(req.username().trim(), req.code());
        Map<String, Object> body = verificationBody(result);
        return result.isValid()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
    }

    @GetMapping("/status/{username}")
    @Operation(summary = "Read-only state of the user's latest challenge")
    public ResponseEntity<?> status(@PathVariable("username") String username) {
        Optional<OtpChallengeStatus> status = otp.status(username.trim());
        if (status.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "error", "no_challenge",
                    "message", "No verification code has been requested"));
        }
        OtpChallengeStatus s = status.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", s.active());
        body.put("verified", s.verified());
        body.put("createdAt", s.createdAt());
        body.put("expiresAt", s.expiresAt());
        body.put("remainingSeconds", s.remainingSeconds());
        body.put("remainingTime", s.remainingTime());
        body.put("attempts", s.attempts());
        body.put("attemptsRemaining", s.attemptsRemaining());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/complete")
    @Operation(summary = "Finish a challenged login with the emailed code",
            description = "On success returns a session token and, when `trustDevice` is true, remembers the device.")
    public ResponseEntity<?> complete(@Valid @RequestBody OtpCompleteRequest req, HttpServletRequest http) {
        String username = req.username().trim();
        ChallengeCompletion completion = decisions.completeChallenge(new CompleteChallengeCommand(
                username, req.code(), req.deviceFingerprint(), ClientAddresses.resolve(http), req.trustDevice()));

        Map<String, Object> body = verificationBody(completion.getVerification());
        body.put("decision", completion.getState().toDecision().wireValue());
        if (!completion.isAllowed()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
        }

        body.put("accessToken", jwt.generateToken(username, accounts.findRoles(username), JwtService.AUTH_METHOD_OTP));
        body.put("tokenType", "Bearer");
        body.put("expiresInSeconds", jwt.getTtlSeconds());
        body.put("deviceRegistered", completion.isDeviceRegistered());
        log.info("Challenged login completed for {}", username);
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> verificationBody(OtpVerificationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", result.isValid());
        body.put("message", result.getMessage());
        if (!result.isValid()) {
            body.put("reason", result.getFailureReason().name());
            if (result.getAttemptsRemaining() != null) {
                body.put("attemptsRemaining", result.getAttemptsRemaining());
            }
        }
        return body;
    }
}
