package com.ztverify.riskauth.domain.otp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * What a caller learns about a freshly issued (or still active) challenge. Never carries the code.
 */
public record IssuedChallenge(UUID challengeId, OffsetDateTime expiresAt, long expiresInSeconds, boolean reused) {
}
