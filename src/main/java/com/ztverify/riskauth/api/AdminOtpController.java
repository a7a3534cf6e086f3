package com.ztverify.riskauth.api;

import com.ztverify.riskauth.application.OtpChallengeService;
import com.ztverify.riskauth.domain.otp.IssuedChallenge;
import com.ztverify.riskauth.domain.otp.RemainingTime;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/otp")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - one-time passcodes", description = "Support actions on a user's OTP challenge")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminOtpController {

    private static final Logger log = LoggerFactory.getLogger(AdminOtpController.class);

    private final OtpChallengeService otp;

    public AdminOtpController(OtpChallengeService otp) {
        this.otp = otp;
    }

    @PostMapping("/{username}/reissue")
    @Operation(summary = "Close the user's open challenge and send a fresh code",
            description = "Resets the attempt counter. Only administrators may bypass the active-challenge limit.")
    public ResponseEntity<?> reissue(@PathVariable("username") String username, Authentication auth) {
        IssuedChallenge issued = otp.issue(username.trim(), true);
        log.info("OTP challenge for {} reissued by {}", username, auth.getName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username.trim());
        body.put("challengeId", issued.challengeId());
        body.put("expiresAt", issued.expiresAt());
        body.put("expiresInSeconds", issued.expiresInSeconds());
        body.put("expiresIn", RemainingTime.format(issued.expiresInSeconds()));
        return ResponseEntity.ok(body);
    }
}
