package com.ztverify.riskauth.api;

import com.ztverify.riskauth.api.dto.AuthenticateRequest;
import com.ztverify.riskauth.application.AuthenticateCommand;
import com.ztverify.riskauth.application.AuthenticationDecisionService;
import com.ztverify.riskauth.application.AuthenticationResult;
import com.ztverify.riskauth.config.JwtService;
import com.ztverify.riskauth.domain.decision.AuthState;
import com.ztverify.riskauth.domain.otp.IssuedChallenge;
import com.ztverify.riskauth.domain.otp.RemainingTime;
import com.ztverify.riskauth.domain.ports.CredentialVerifierPort;
import com.ztverify.riskauth.domain.risk.RiskAssessment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Authentication", description = "Risk-adaptive login decisions")
public class AuthenticationController {

    private final AuthenticationDecisionService decisions;
    private final CredentialVerifierPort accounts;
    private final JwtService jwt;

    public AuthenticationController(AuthenticationDecisionService decisions, CredentialVerifierPort accounts,
                                    JwtService jwt) {
        this.decisions = decisions;
        this.accounts = accounts;
        this.jwt = jwt;
    }

    @PostMapping("/authenticate")
    @Operation(
            summary = "Score a login and decide allow / challenge / deny",
            description = """
        Verifies the credentials, scores the login context and returns a decision.

        - `allow`: a Bearer session token is included
        - `challenge`: a one-time code has been emailed; finish with `POST /api/otp/complete`
        - `deny`: credentials invalid or account not active (HTTP 401, no further detail)
        """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Allowed or challenged",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                        {
                            "decision": "challenge",
                            "riskScore": 0.4,
                            "riskLevel": "MEDIUM",
                            "reason": "medium_risk_unknown_device",
                            "factors": ["Partner country (US)"],
                            "challenge": {"expiresInSeconds": 300, "reused": false}
                        }
                        """))),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "503", description = "Audit log or mail delivery unavailable")
    })
    public ResponseEntity<?> authenticate(@Valid @RequestBody AuthenticateRequest req,
                                          @RequestHeader(value = "User-Agent", required = false) String userAgentHeader,
                                          HttpServletRequest http) {
        AuthenticateCommand cmd = new AuthenticateCommand(
                req.username().trim(),
                req.secret(),
                req.timestamp(),
                req.sourceIp() != null && !req.sourceIp().isBlank() ? req.sourceIp().trim() : ClientAddresses.resolve(http),
                req.userAgent() != null ? req.userAgent() : userAgentHeader,
                req.deviceFingerprint(),
                req.asn(),
                req.countryCode(),
                req.location(),
                req.deviceType());

        AuthenticationResult result = decisions.authenticate(cmd);

        if (result.getState() == AuthState.DENIED) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("decision", "deny");
            body.put("riskScore", null);
            body.put("reason", "invalid_credentials");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("decision", result.getState().toDecision().wireValue());
        RiskAssessment assessment = result.getAssessment();
        body.put("riskScore", assessment.externalScore());
        body.put("riskLevel", assessment.getLevel().name());
        body.put("reason", result.getReason().toLowerCase());
        body.put("factors", assessment.getFactors());
        body.put("scoreSource", assessment.getSource().name());

        if (result.getState() == AuthState.ALLOWED) {
            body.put("accessToken", jwt.generateToken(result.getUsername(),
                    accounts.findRoles(result.getUsername()), JwtService.AUTH_METHOD_RISK));
            body.put("tokenType", "Bearer");
            body.put("expiresInSeconds", jwt.getTtlSeconds());
        } else {
            IssuedChallenge challenge = result.getChallenge();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("challengeId", challenge.challengeId());
            info.put("expiresAt", challenge.expiresAt());
            info.put("expiresInSeconds", challenge.expiresInSeconds());
            info.put("expiresIn", RemainingTime.format(challenge.expiresInSeconds()));
            info.put("reused", challenge.reused());
            info.put("message", challenge.reused()
                    ? "A verification code was already sent and is still valid"
                    : "A verification code has been sent to your registered email");
            body.put("challenge", info);
        }
        return ResponseEntity.ok(body);
    }
}
