package com.ztverify.riskauth.infrastructure.adapters;

import com.ztverify.riskauth.domain.otp.OtpChallenge;
import com.ztverify.riskauth.domain.ports.OtpChallengeRepository;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import com.ztverify.riskauth.infrastructure.jpa.OtpChallengeEntity;
import com.ztverify.riskauth.infrastructure.jpa.SpringOtpChallengeRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaOtpChallengeRepositoryAdapter implements OtpChallengeRepository {

    private final SpringOtpChallengeRepository challenges;

    public JpaOtpChallengeRepositoryAdapter(SpringOtpChallengeRepository challenges) {
        this.challenges = challenges;
    }

    @Override
    public OtpChallenge save(OtpChallenge c) {
        OtpChallengeEntity e = new OtpChallengeEntity();
        e.setId(c.getId());
        e.setUsername(c.getUsername());
        e.setCodeHash(c.getCodeHash());
        e.setCreatedAt(c.getCreatedAt());
        e.setExpiresAt(c.getExpiresAt());
        e.setAttempts(c.getAttempts());
        e.setVerified(c.isVerified());
        e.setInvalidated(c.isInvalidated());
        try {
            challenges.save(e);
            return c;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to store OTP challenge for " + c.getUsername(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OtpChallenge> findLatest(String username) {
        try {
            return challenges.findFirstByUsernameOrderByCreatedAtDesc(username).map(this::toDomain);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to read OTP challenge for " + username, ex);
        }
    }

    @Override
    @Transactional
    public boolean incrementAttempts(UUID challengeId, int maxAttempts) {
        try {
            return challenges.incrementAttempts(challengeId, maxAttempts) == 1;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to record OTP attempt", ex);
        }
    }

    @Override
    @Transactional
    public boolean markVerified(UUID challengeId, int maxAttempts, OffsetDateTime now) {
        try {
            return challenges.markVerified(challengeId, maxAttempts, now) == 1;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to mark OTP challenge verified", ex);
        }
    }

    @Override
    @Transactional
    public void delete(UUID challengeId) {
        try {
            challenges.deleteById(challengeId);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to delete OTP challenge " + challengeId, ex);
        }
    }

    @Override
    @Transactional
    public int invalidateOpen(String username) {
        try {
            return challenges.invalidateOpen(username);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to invalidate OTP challenges for " + username, ex);
        }
    }

    private OtpChallenge toDomain(OtpChallengeEntity e) {
        return new OtpChallenge(e.getId(), e.getUsername(), e.getCodeHash(), e.getCreatedAt(),
                e.getExpiresAt(), e.getAttempts(), e.isVerified(), e.isInvalidated());
    }
}
