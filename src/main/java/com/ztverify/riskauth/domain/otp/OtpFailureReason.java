package com.ztverify.riskauth.domain.otp;

public enum OtpFailureReason {
    NO_ACTIVE_CHALLENGE("No verification code has been requested. Please request a new code."),
    EXPIRED("Verification code has expired. Please request a new code."),
    ATTEMPTS_EXHAUSTED("Maximum verification attempts exceeded. Please request a new code."),
    ALREADY_VERIFIED("Verification code has already been used. Please request a new code."),
    INVALID_CODE("Invalid verification code.");

    private final String message;

    OtpFailureReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
