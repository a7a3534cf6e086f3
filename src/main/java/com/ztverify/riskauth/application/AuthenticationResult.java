package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.decision.AuthState;
import com.ztverify.riskauth.domain.otp.IssuedChallenge;
import com.ztverify.riskauth.domain.risk.RiskAssessment;

/**
 * Outcome of one pass through the decision state machine. {@code assessment} is null for
 * credential denials; {@code challenge} is set only when the state is {@link AuthState#CHALLENGED}.
 */
public class AuthenticationResult {

    private final String username;
    private final AuthState state;
    private final String reason;
    private final RiskAssessment assessment;
    private final IssuedChallenge challenge;

    private AuthenticationResult(String username, AuthState state, String reason,
                                 RiskAssessment assessment, IssuedChallenge challenge) {
        this.username = username;
        this.state = state;
        this.reason = reason;
        this.assessment = assessment;
        this.challenge = challenge;
    }

    public static AuthenticationResult denied(String username, String reason) {
        return new AuthenticationResult(username, AuthState.DENIED, reason, null, null);
    }

    public static AuthenticationResult allowed(String username, String reason, RiskAssessment assessment) {
        return new AuthenticationResult(username, AuthState.ALLOWED, reason, assessment, null);
    }

    public static AuthenticationResult challenged(String username, String reason, RiskAssessment assessment,
                                                  IssuedChallenge challenge) {
        return new AuthenticationResult(username, AuthState.CHALLENGED, reason, assessment, challenge);
    }

    public String getUsername() { return username; }
    public AuthState getState() { return state; }
    public String getReason() { return reason; }
    public RiskAssessment getAssessment() { return assessment; }
    public IssuedChallenge getChallenge() { return challenge; }

    public Double getExternalRiskScore() {
        return assessment == null ? null : assessment.externalScore();
    }
}
