package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginStats;
import com.ztverify.riskauth.domain.ports.LoginAttemptRepository;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Writes and reads the login audit trail. A failed write is never swallowed: the login that
 * produced it must fail too.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final LoginAttemptRepository attempts;
    private final Clock clock;
    private final int maxPageSize;

    public AuditLogService(LoginAttemptRepository attempts, Clock clock,
                           @Value("${app.audit.max-page-size:500}") int maxPageSize) {
        this.attempts = attempts;
        this.clock = clock;
        this.maxPageSize = maxPageSize;
    }

    public LoginAttempt record(LoginAttempt attempt) {
        try {
            LoginAttempt stored = attempts.append(attempt);
            log.info("Audit: user={} decision={} succeeded={} reason={} score={}",
                    attempt.getUsername(), attempt.getDecision().wireValue(), attempt.isSucceeded(),
                    attempt.getReason(), attempt.getRiskScore());
            return stored;
        } catch (StorageUnavailableException e) {
            log.error("Audit write failed for {}: {}", attempt.getUsername(), e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Audit write failed for {}: {}", attempt.getUsername(), e.getMessage(), e);
            throw new StorageUnavailableException("Audit log unavailable", e);
        }
    }

    public List<LoginAttempt> recent(int limit) {
        return attempts.findRecent(clampLimit(limit));
    }

    public List<LoginAttempt> recentForUser(String username, int limit) {
        return attempts.findRecentByUsername(username, clampLimit(limit));
    }

    public LoginStats statsForLastDays(int days) {
        int window = Math.max(1, Math.min(days, 365));
        return attempts.statsSince(OffsetDateTime.now(clock).minus(Duration.ofDays(window)));
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, maxPageSize));
    }
}
