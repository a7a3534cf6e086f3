package com.ztverify.riskauth.domain.otp;

import java.time.OffsetDateTime;

public record OtpChallengeStatus(OffsetDateTime createdAt,
                                 OffsetDateTime expiresAt,
                                 long remainingSeconds,
                                 int attempts,
                                 int attemptsRemaining,
                                 boolean verified,
                                 boolean active) {

    public String remainingTime() {
        return RemainingTime.format(remainingSeconds);
    }
}
