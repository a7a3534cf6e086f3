package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.otp.IssuedChallenge;
import com.ztverify.riskauth.domain.otp.OtpChallenge;
import com.ztverify.riskauth.domain.otp.OtpChallengeStatus;
import com.ztverify.riskauth.domain.otp.OtpCodeGenerator;
import com.ztverify.riskauth.domain.otp.OtpFailureReason;
import com.ztverify.riskauth.domain.otp.OtpVerificationResult;
import com.ztverify.riskauth.domain.ports.CredentialVerifierPort;
import com.ztverify.riskauth.domain.ports.OtpChallengeRepository;
import com.ztverify.riskauth.domain.ports.OtpNotifierPort;
import com.ztverify.riskauth.exception.ChallengeAlreadyActiveException;
import com.ztverify.riskauth.exception.InvalidCredentialsException;
import com.ztverify.riskauth.exception.MalformedCodeException;
import com.ztverify.riskauth.exception.NotifierUnavailableException;
import com.ztverify.riskauth.infrastructure.security.OtpCodeHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Issues, verifies and reports on emailed one-time passcodes.
 *
 * <p>Issuance is serialized per username. Verification relies on the repository's conditional
 * updates, so concurrent attempts can neither exceed the attempt cap nor verify a code twice.
 */
@Service
public class OtpChallengeService {

    private static final Logger log = LoggerFactory.getLogger(OtpChallengeService.class);

    private final OtpChallengeRepository challenges;
    private final OtpNotifierPort notifier;
    private final CredentialVerifierPort accounts;
    private final OtpCodeHasher hasher;
    private final OtpCodeGenerator generator;
    private final UserLockRegistry locks;
    private final Clock clock;

    private final int codeLength;
    private final Duration lifetime;
    private final int maxAttempts;
    private final Pattern codePattern;

    public OtpChallengeService(OtpChallengeRepository challenges,
                               OtpNotifierPort notifier,
                               CredentialVerifierPort accounts,
                               OtpCodeHasher hasher,
                               OtpCodeGenerator generator,
                               UserLockRegistry locks,
                               Clock clock,
                               @Value("${app.otp.code-length:6}") int codeLength,
                               @Value("${app.otp.lifetime-seconds:300}") long lifetimeSeconds,
                               @Value("${app.otp.max-attempts:3}") int maxAttempts) {
        this.challenges = challenges;
        this.notifier = notifier;
        this.accounts = accounts;
        this.hasher = hasher;
        this.generator = generator;
        this.locks = locks;
        this.clock = clock;
        this.codeLength = codeLength;
        this.lifetime = Duration.ofSeconds(lifetimeSeconds);
        this.maxAttempts = maxAttempts;
        this.codePattern = Pattern.compile("\\d{" + codeLength + "}");

        log.info("OTP service initialized - length: {}, lifetime: {}s, maxAttempts: {}",
                codeLength, lifetimeSeconds, maxAttempts);
    }

    public IssuedChallenge issue(String username) {
        return issue(username, false);
    }

    /**
     * Issues a new code.
     *
     * @param replaceActive close a still-active challenge instead of rejecting the request
     * @throws ChallengeAlreadyActiveException when a challenge is active and {@code replaceActive} is false
     * @throws NotifierUnavailableException when delivery fails; nothing stays stored in that case
     */
    public IssuedChallenge issue(String username, boolean replaceActive) {
        String destination = resolveDestination(username);
        return locks.withUserLock(username, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Optional<OtpChallenge> active = challenges.findLatest(username).filter(c -> c.isActive(now, maxAttempts));
            if (active.isPresent()) {
                if (!replaceActive) {
                    long remaining = active.get().remainingSeconds(now);
                    log.info("OTP request for {} rejected, active challenge expires in {}s", username, remaining);
                    throw new ChallengeAlreadyActiveException(remaining);
                }
                invalidate(username);
            }
            return createAndDeliver(username, destination, now);
        });
    }

    /**
     * Self-service request for a code. Never replaces an active challenge, and an account that
     * cannot receive codes yields an empty result instead of an error so the caller's response
     * does not reveal whether the username exists.
     *
     * @throws ChallengeAlreadyActiveException when a challenge is still active
     */
    public Optional<IssuedChallenge> requestCode(String username) {
        if (accounts.findContactEmail(username).isEmpty()) {
            log.info("OTP request for {} ignored, no contact address on file", username);
            return Optional.empty();
        }
        return Optional.of(issue(username, false));
    }

    /**
     * Login path: returns the active challenge if there is one, otherwise issues a new code.
     */
    public IssuedChallenge issueOrReuse(String username) {
        String destination = resolveDestination(username);
        return locks.withUserLock(username, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Optional<OtpChallenge> active = challenges.findLatest(username).filter(c -> c.isActive(now, maxAttempts));
            if (active.isPresent()) {
                OtpChallenge c = active.get();
                log.info("Reusing active OTP challenge for {} ({}s left)", username, c.remainingSeconds(now));
                return new IssuedChallenge(c.getId(), c.getExpiresAt(), c.remainingSeconds(now), true);
            }
            return createAndDeliver(username, destination, now);
        });
    }

    public OtpVerificationResult verify(String username, String code) {
        String submitted = code == null ? "" : code.strip();
        if (!codePattern.matcher(submitted).matches()) {
            throw new MalformedCodeException("Verification code must be exactly " + codeLength + " digits");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<OtpChallenge> latest = challenges.findLatest(username);
        if (latest.isEmpty()) {
            return OtpVerificationResult.failure(OtpFailureReason.NO_ACTIVE_CHALLENGE);
        }
        OtpChallenge challenge = latest.get();
        Optional<OtpFailureReason> closed = closedReason(challenge, now);
        if (closed.isPresent()) {
            log.info("OTP verification for {} refused: {}", username, closed.get());
            return OtpVerificationResult.failure(closed.get());
        }

        if (hasher.matches(username, submitted, challenge.getCodeHash())) {
            if (challenges.markVerified(challenge.getId(), maxAttempts, now)) {
                log.info("OTP verified for {}", username);
                return OtpVerificationResult.success();
            }
            // Lost a race with a concurrent verify or increment.
            return OtpVerificationResult.failure(reclassify(username, now));
        }

        if (!challenges.incrementAttempts(challenge.getId(), maxAttempts)) {
            return OtpVerificationResult.failure(reclassify(username, now));
        }
        int remaining = challenges.findLatest(username)
                .filter(c -> c.getId().equals(challenge.getId()))
                .map(c -> c.attemptsRemaining(maxAttempts))
                .orElse(challenge.attemptsRemaining(maxAttempts) - 1);
        log.warn("Invalid OTP for {} ({} attempt(s) remaining)", username, remaining);
        return OtpVerificationResult.invalidCode(Math.max(0, remaining));
    }

    public Optional<OtpChallengeStatus> status(String username) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return challenges.findLatest(username).map(c -> new OtpChallengeStatus(
                c.getCreatedAt(),
                c.getExpiresAt(),
                c.remainingSeconds(now),
                c.getAttempts(),
                c.attemptsRemaining(maxAttempts),
                c.isVerified(),
                c.isActive(now, maxAttempts)));
    }

    public int invalidate(String username) {
        int closed = challenges.invalidateOpen(username);
        if (closed > 0) {
            log.info("Invalidated {} open OTP challenge(s) for {}", closed, username);
        }
        return closed;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getLifetimeSeconds() {
        return lifetime.getSeconds();
    }

    private IssuedChallenge createAndDeliver(String username, String destination, OffsetDateTime now) {
        String code = generator.generate(codeLength);
        OtpChallenge challenge = OtpChallenge.issue(username, hasher.hash(username, code), now, lifetime);
        challenges.save(challenge);

        boolean delivered;
        try {
            delivered = notifier.send(destination, code, username);
        } catch (RuntimeException e) {
            challenges.delete(challenge.getId());
            throw new NotifierUnavailableException("OTP delivery failed for " + username, e);
        }
        if (!delivered) {
            challenges.delete(challenge.getId());
            throw new NotifierUnavailableException("OTP delivery failed for " + username);
        }

        log.info("OTP challenge {} issued for {}, expires at {}", challenge.getId(), username, challenge.getExpiresAt());
        return new IssuedChallenge(challenge.getId(), challenge.getExpiresAt(), challenge.remainingSeconds(now), false);
    }

    private String resolveDestination(String username) {
        return accounts.findContactEmail(username)
                .orElseThrow(() -> new InvalidCredentialsException("No contact address on file for " + username));
    }

    private Optional<OtpFailureReason> closedReason(OtpChallenge c, OffsetDateTime now) {
        if (c.isInvalidated()) {
            return Optional.of(OtpFailureReason.NO_ACTIVE_CHALLENGE);
        }
        if (c.isExpired(now)) {
            return Optional.of(OtpFailureReason.EXPIRED);
        }
        if (c.isExhausted(maxAttempts)) {
            return Optional.of(OtpFailureReason.ATTEMPTS_EXHAUSTED);
        }
        if (c.isVerified()) {
            return Optional.of(OtpFailureReason.ALREADY_VERIFIED);
        }
        return Optional.empty();
    }

    private OtpFailureReason reclassify(String username, OffsetDateTime now) {
        return challenges.findLatest(username)
                .flatMap(c -> closedReason(c, now))
                .orElse(OtpFailureReason.NO_ACTIVE_CHALLENGE);
    }
}
