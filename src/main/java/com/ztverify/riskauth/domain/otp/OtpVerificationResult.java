package com.ztverify.riskauth.domain.otp;

public class OtpVerificationResult {

    private final boolean valid;
    private final OtpFailureReason failureReason;
    private final Integer attemptsRemaining;
    private final String message;

    private OtpVerificationResult(boolean valid, OtpFailureReason failureReason, Integer attemptsRemaining, String message) {
        this.valid = valid;
        this.failureReason = failureReason;
        this.attemptsRemaining = attemptsRemaining;
        this.message = message;
    }

    public static OtpVerificationResult success() {
        return new OtpVerificationResult(true, null, null, "Verification successful");
    }

    public static OtpVerificationResult failure(OtpFailureReason reason) {
        return new OtpVerificationResult(false, reason, null, reason.getMessage());
    }

    public static OtpVerificationResult invalidCode(int attemptsRemaining) {
        String message = attemptsRemaining > 0
                ? OtpFailureReason.INVALID_CODE.getMessage() + " " + attemptsRemaining + " attempt(s) remaining."
                : OtpFailureReason.INVALID_CODE.getMessage() + " No attempts remaining. Please request a new code.";
        return new OtpVerificationResult(false, OtpFailureReason.INVALID_CODE, attemptsRemaining, message);
    }

    public boolean isValid() { return valid; }
    public OtpFailureReason getFailureReason() { return failureReason; }
    public Integer getAttemptsRemaining() { return attemptsRemaining; }
    public String getMessage() { return message; }

    /** True when this result leaves the challenge unusable. */
    public boolean closesChallenge() {
        if (valid) {
            return true;
        }
        return failureReason != OtpFailureReason.INVALID_CODE
                || (attemptsRemaining != null && attemptsRemaining == 0);
    }
}
