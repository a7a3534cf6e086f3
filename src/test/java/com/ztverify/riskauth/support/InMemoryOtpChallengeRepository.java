package com.ztverify.riskauth.support;

import com.ztverify.riskauth.domain.otp.OtpChallenge;
import com.ztverify.riskauth.domain.ports.OtpChallengeRepository;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Conditional updates are synchronized to mirror the atomic UPDATE ... WHERE of the JPA adapter. */
public class InMemoryOtpChallengeRepository implements OtpChallengeRepository {

    private final Map<UUID, OtpChallenge> challenges = new LinkedHashMap<>();

    public synchronized int size() {
        return challenges.size();
    }

    @Override
    public synchronized OtpChallenge save(OtpChallenge challenge) {
        challenges.put(challenge.getId(), challenge);
        return challenge;
    }

    @Override
    public synchronized Optional<OtpChallenge> findLatest(String username) {
        // Later insertion wins on equal creation time.
        return challenges.values().stream()
                .filter(c -> c.getUsername().equals(username))
                .reduce((a, b) -> b.getCreatedAt().isBefore(a.getCreatedAt()) ? a : b);
    }

    @Override
    public synchronized boolean incrementAttempts(UUID challengeId, int maxAttempts) {
        OtpChallenge c = challenges.get(challengeId);
        if (c == null || c.isVerified() || c.isInvalidated() || c.getAttempts() >= maxAttempts) {
            return false;
        }
        challenges.put(challengeId, copy(c, c.getAttempts() + 1, false, false));
        return true;
    }

    @Override
    public synchronized boolean markVerified(UUID challengeId, int maxAttempts, OffsetDateTime now) {
        OtpChallenge c = challenges.get(challengeId);
        if (c == null || c.isVerified() || c.isInvalidated() || c.getAttempts() >= maxAttempts
                || now.isAfter(c.getExpiresAt())) {
            return false;
        }
        challenges.put(challengeId, copy(c, c.getAttempts(), true, false));
        return true;
    }

    @Override
    public synchronized void delete(UUID challengeId) {
        challenges.remove(challengeId);
    }

    @Override
    public synchronized int invalidateOpen(String username) {
        int closed = 0;
        for (OtpChallenge c : challenges.values().toArray(new OtpChallenge[0])) {
            if (c.getUsername().equals(username) && !c.isVerified() && !c.isInvalidated()) {
                challenges.put(c.getId(), copy(c, c.getAttempts(), false, true));
                closed++;
            }
        }
        return closed;
    }

    private static OtpChallenge copy(OtpChallenge c, int attempts, boolean verified, boolean invalidated) {
        return new OtpChallenge(c.getId(), c.getUsername(), c.getCodeHash(), c.getCreatedAt(), c.getExpiresAt(),
                attempts, c.isVerified() || verified, c.isInvalidated() || invalidated);
    }
}
