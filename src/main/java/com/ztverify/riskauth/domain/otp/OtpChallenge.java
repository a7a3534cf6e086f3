package com.ztverify.riskauth.domain.otp;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One issued one-time passcode. Only the keyed hash of the code is held.
 * Terminal once verified, invalidated, expired or out of attempts; expiry is evaluated lazily.
 */
public class OtpChallenge {

    private final UUID id;
    private final String username;
    private final String codeHash;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime expiresAt;
    private final int attempts;
    private final boolean verified;
    private final boolean invalidated;

    public OtpChallenge(UUID id, String username, String codeHash, OffsetDateTime createdAt,
                        OffsetDateTime expiresAt, int attempts, boolean verified, boolean invalidated) {
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
        this.id = id;
        this.username = username;
        this.codeHash = codeHash;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.attempts = attempts;
        this.verified = verified;
        this.invalidated = invalidated;
    }

    public static OtpChallenge issue(String username, String codeHash, OffsetDateTime now, Duration lifetime) {
        return new OtpChallenge(UUID.randomUUID(), username, codeHash, now, now.plus(lifetime), 0, false, false);
    }

    public boolean isExpired(OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isExhausted(int maxAttempts) {
        return attempts >= maxAttempts;
    }

    public boolean isActive(OffsetDateTime now, int maxAttempts) {
        return !verified && !invalidated && !isExpired(now) && !isExhausted(maxAttempts);
    }

    public long remainingSeconds(OffsetDateTime now) {
        return Math.max(0L, Duration.between(now, expiresAt).getSeconds());
    }

    public int attemptsRemaining(int maxAttempts) {
        return Math.max(0, maxAttempts - attempts);
    }

    public UUID getId() { return id; }
    public String getUsername() { return username; }
    public String getCodeHash() { return codeHash; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getExpiresAt() { return expiresAt; }
    public int getAttempts() { return attempts; }
    public boolean isVerified() { return verified; }
    public boolean isInvalidated() { return invalidated; }
}
