package com.ztverify.riskauth.domain.decision;

import com.ztverify.riskauth.domain.AccountStatus;
import com.ztverify.riskauth.domain.risk.RiskAssessment;
import com.ztverify.riskauth.domain.risk.RiskLevel;

/**
 * Maps credential outcome, risk and device knowledge to the next authentication state.
 * Rules are evaluated in order; the first match wins.
 */
public class DecisionPolicy {

    public record Outcome(AuthState state, String reason) {
    }

    public static final String REASON_ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String REASON_WRONG_SECRET = "WRONG_SECRET";
    public static final String REASON_JURISDICTION = "JURISDICTION_STEP_UP";
    public static final String REASON_HIGH_RISK = "HIGH_RISK";
    public static final String REASON_UNKNOWN_DEVICE = "MEDIUM_RISK_UNKNOWN_DEVICE";
    public static final String REASON_KNOWN_DEVICE = "MEDIUM_RISK_KNOWN_DEVICE";
    public static final String REASON_LOW_RISK = "LOW_RISK";

    /** Credential stage. Returns {@code DENIED} or null when scoring should continue. */
    public Outcome checkCredentials(AccountStatus status, boolean secretValid) {
        if (status == null) {
            return new Outcome(AuthState.DENIED, REASON_ACCOUNT_NOT_FOUND);
        }
        if (!secretValid) {
            return new Outcome(AuthState.DENIED, REASON_WRONG_SECRET);
        }
        if (!status.isActive()) {
            return new Outcome(AuthState.DENIED, "ACCOUNT_" + status.name());
        }
        return null;
    }

    public Outcome decide(RiskAssessment assessment, boolean deviceKnown) {
        if (assessment.isJurisdictionStepUp()) {
            return new Outcome(AuthState.CHALLENGED, REASON_JURISDICTION);
        }
        if (assessment.getLevel() == RiskLevel.HIGH) {
            return new Outcome(AuthState.CHALLENGED, REASON_HIGH_RISK);
        }
        if (assessment.getLevel() == RiskLevel.MEDIUM) {
            return deviceKnown
                    ? new Outcome(AuthState.ALLOWED, REASON_KNOWN_DEVICE)
                    : new Outcome(AuthState.CHALLENGED, REASON_UNKNOWN_DEVICE);
        }
        return new Outcome(AuthState.ALLOWED, REASON_LOW_RISK);
    }
}
