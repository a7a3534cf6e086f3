package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.decision.AuthState;
import com.ztverify.riskauth.domain.otp.OtpVerificationResult;

public class ChallengeCompletion {

    private final AuthState state;
    private final OtpVerificationResult verification;
    private final boolean deviceRegistered;

    public ChallengeCompletion(AuthState state, OtpVerificationResult verification, boolean deviceRegistered) {
        this.state = state;
        this.verification = verification;
        this.deviceRegistered = deviceRegistered;
    }

    public AuthState getState() { return state; }
    public OtpVerificationResult getVerification() { return verification; }
    public boolean isDeviceRegistered() { return deviceRegistered; }

    public boolean isAllowed() {
        return state == AuthState.ALLOWED;
    }
}
