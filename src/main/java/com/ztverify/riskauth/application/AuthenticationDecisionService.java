package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.AccountStatus;
import com.ztverify.riskauth.domain.Decision;
import com.ztverify.riskauth.domain.GeoLocation;
import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginContext;
import com.ztverify.riskauth.domain.decision.AuthState;
import com.ztverify.riskauth.domain.decision.DecisionPolicy;
import com.ztverify.riskauth.domain.otp.IssuedChallenge;
import com.ztverify.riskauth.domain.otp.OtpVerificationResult;
import com.ztverify.riskauth.domain.ports.CredentialVerifierPort;
import com.ztverify.riskauth.domain.ports.DeviceTrustStore;
import com.ztverify.riskauth.domain.ports.GeolocatorPort;
import com.ztverify.riskauth.domain.risk.RiskAssessment;
import com.ztverify.riskauth.domain.risk.RiskFeatureExtractor;
import com.ztverify.riskauth.domain.risk.RiskFeatures;
import com.ztverify.riskauth.domain.risk.RiskScoringEngine;
import com.ztverify.riskauth.exception.AccountNotActiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives one login through UNVERIFIED to ALLOWED, CHALLENGED or DENIED, and a challenged login
 * on to ALLOWED or DENIED. Every transition is written to the audit log before the caller sees it.
 */
@Service
public class AuthenticationDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationDecisionService.class);

    public static final String REASON_OTP_VERIFIED = "OTP_VERIFIED";

    private final CredentialVerifierPort credentials;
    private final GeolocatorPort geolocator;
    private final RiskFeatureExtractor featureExtractor;
    private final RiskScoringEngine scoringEngine;
    private final DecisionPolicy decisionPolicy;
    private final DeviceTrustStore deviceTrust;
    private final OtpChallengeService otpService;
    private final AuditLogService auditLog;
    private final Executor geoExecutor;
    private final Clock clock;
    private final long geoTimeoutMs;

    public AuthenticationDecisionService(CredentialVerifierPort credentials,
                                         GeolocatorPort geolocator,
                                         RiskFeatureExtractor featureExtractor,
                                         RiskScoringEngine scoringEngine,
                                         DecisionPolicy decisionPolicy,
                                         DeviceTrustStore deviceTrust,
                                         OtpChallengeService otpService,
                                         AuditLogService auditLog,
                                         @Qualifier("geoLookupExecutor") Executor geoExecutor,
                                         Clock clock,
                                         @Value("${app.geo.timeout-ms:2000}") long geoTimeoutMs) {
        this.credentials = credentials;
        this.geolocator = geolocator;
        this.featureExtractor = featureExtractor;
        this.scoringEngine = scoringEngine;
        this.decisionPolicy = decisionPolicy;
        this.deviceTrust = deviceTrust;
        this.otpService = otpService;
        this.auditLog = auditLog;
        this.geoExecutor = geoExecutor;
        this.clock = clock;
        this.geoTimeoutMs = geoTimeoutMs;
    }

    public AuthenticationResult authenticate(AuthenticateCommand cmd) {
        OffsetDateTime timestamp = cmd.timestamp != null ? cmd.timestamp : OffsetDateTime.now(clock);
        log.info("Authentication request for {} from {}", cmd.username, cmd.sourceIp);

        // Geolocation overlaps with the credential check.
        CompletableFuture<Optional<GeoLocation>> geo = lookupLocation(cmd);

        AccountStatus status = credentials.getAccountStatus(cmd.username).orElse(null);
        boolean secretValid = status != null && credentials.verify(cmd.username, cmd.secret);
        DecisionPolicy.Outcome credentialOutcome = decisionPolicy.checkCredentials(status, secretValid);
        if (credentialOutcome != null) {
            geo.cancel(true);
            auditLog.record(new LoginAttempt(null, cmd.username, timestamp, cmd.sourceIp, cmd.deviceFingerprint,
                    cmd.location, null, Decision.DENY, false, credentialOutcome.reason(), List.of()));
            log.warn("Authentication denied for {}: {}", cmd.username, credentialOutcome.reason());
            return AuthenticationResult.denied(cmd.username, credentialOutcome.reason());
        }

        Optional<GeoLocation> location = geo.join();
        String country = cmd.countryCode != null && !cmd.countryCode.isBlank()
                ? cmd.countryCode
                : location.map(GeoLocation::countryCode).orElse(LoginContext.UNKNOWN_COUNTRY);
        String locationName = cmd.location != null && !cmd.location.isBlank()
                ? cmd.location
                : location.map(GeoLocation::displayName).orElse(null);

        LoginContext ctx = new LoginContext(cmd.username, timestamp, cmd.sourceIp, country,
                cmd.asn != null ? cmd.asn : 0, cmd.userAgent, cmd.deviceFingerprint, locationName, cmd.deviceType);
        RiskFeatures features = featureExtractor.extract(ctx);
        RiskAssessment assessment = scoringEngine.assess(cmd.username, features);
        DecisionPolicy.Outcome outcome = decisionPolicy.decide(assessment, features.knownDevice());

        if (outcome.state() == AuthState.ALLOWED) {
            // Audit first: a device is trusted only once its allow is on record.
            auditLog.record(audit(ctx, assessment, Decision.ALLOW, true, outcome.reason()));
            if (!ctx.deviceFingerprint().isBlank()) {
                deviceTrust.registerOrTouch(cmd.username, ctx.deviceFingerprint());
            }
            log.info("Authentication allowed for {} (score {}, {})", cmd.username, assessment.getScore(), outcome.reason());
            return AuthenticationResult.allowed(cmd.username, outcome.reason(), assessment);
        }

        auditLog.record(audit(ctx, assessment, Decision.CHALLENGE, false, outcome.reason()));
        IssuedChallenge challenge = otpService.issueOrReuse(cmd.username);
        log.info("Authentication challenged for {} (score {}, {})", cmd.username, assessment.getScore(), outcome.reason());
        return AuthenticationResult.challenged(cmd.username, outcome.reason(), assessment, challenge);
    }

    /**
     * Second leg of a challenged login. Risk is not re-scored; a correct code unlocks the allow.
     */
    public ChallengeCompletion completeChallenge(CompleteChallengeCommand cmd) {
        OtpVerificationResult verification = otpService.verify(cmd.username, cmd.code);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (!verification.isValid()) {
            if (!verification.closesChallenge()) {
                return new ChallengeCompletion(AuthState.CHALLENGED, verification, false);
            }
            auditLog.record(new LoginAttempt(null, cmd.username, now, cmd.sourceIp, cmd.deviceFingerprint,
                    null, null, Decision.DENY, false, "OTP_" + verification.getFailureReason().name(), List.of()));
            log.warn("Challenge for {} closed without success: {}", cmd.username, verification.getFailureReason());
            return new ChallengeCompletion(AuthState.DENIED, verification, false);
        }

        AccountStatus status = credentials.getAccountStatus(cmd.username).orElse(null);
        if (status == null || !status.isActive()) {
            String reason = status == null ? DecisionPolicy.REASON_ACCOUNT_NOT_FOUND : "ACCOUNT_" + status.name();
            auditLog.record(new LoginAttempt(null, cmd.username, now, cmd.sourceIp, cmd.deviceFingerprint,
                    null, null, Decision.DENY, false, reason, List.of()));
            throw new AccountNotActiveException("Account " + cmd.username + " is no longer active");
        }

        auditLog.record(new LoginAttempt(null, cmd.username, now, cmd.sourceIp, cmd.deviceFingerprint,
                null, null, Decision.ALLOW, true, REASON_OTP_VERIFIED, List.of()));
        boolean register = cmd.registerDevice && cmd.deviceFingerprint != null && !cmd.deviceFingerprint.isBlank();
        if (register) {
            deviceTrust.registerOrTouch(cmd.username, cmd.deviceFingerprint);
        }
        log.info("Challenge completed for {} (device registered: {})", cmd.username, register);
        return new ChallengeCompletion(AuthState.ALLOWED, verification, register);
    }

    private CompletableFuture<Optional<GeoLocation>> lookupLocation(AuthenticateCommand cmd) {
        boolean hasCountry = cmd.countryCode != null && !cmd.countryCode.isBlank();
        boolean hasLocation = cmd.location != null && !cmd.location.isBlank();
        if ((hasCountry && hasLocation) || cmd.sourceIp == null || cmd.sourceIp.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.supplyAsync(() -> geolocator.lookup(cmd.sourceIp), geoExecutor)
                    .exceptionally(e -> {
                        log.warn("Geolocation for {} failed: {}", cmd.sourceIp, e.getMessage());
                        return Optional.empty();
                    })
                    .completeOnTimeout(Optional.empty(), geoTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Geolocation pool saturated, scoring {} without location", cmd.username);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    private LoginAttempt audit(LoginContext ctx, RiskAssessment assessment, Decision decision,
                               boolean succeeded, String reason) {
        return new LoginAttempt(null, ctx.username(), ctx.timestamp(), ctx.sourceIp(), ctx.deviceFingerprint(),
                ctx.location(), assessment.externalScore(), decision, succeeded, reason, assessment.getFactors());
    }
}
