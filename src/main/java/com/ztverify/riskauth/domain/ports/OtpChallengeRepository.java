package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.otp.OtpChallenge;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for OTP challenges. The two conditional updates must be atomic at the storage level
 * so that concurrent verifications cannot exceed the attempt cap or verify twice.
 */
public interface OtpChallengeRepository {

    OtpChallenge save(OtpChallenge challenge);

    Optional<OtpChallenge> findLatest(String username);

    /** Increments attempts only while {@code attempts < maxAttempts} and the challenge is open. */
    boolean incrementAttempts(UUID challengeId, int maxAttempts);

    /** Marks verified only while the challenge is open, unexpired at {@code now} and under the cap. */
    boolean markVerified(UUID challengeId, int maxAttempts, OffsetDateTime now);

    void delete(UUID challengeId);

    /** Closes every open challenge of the user; returns how many were closed. */
    int invalidateOpen(String username);
}
