package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginStats;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Append-only audit trail of login attempts.
 */
public interface LoginAttemptRepository {

    LoginAttempt append(LoginAttempt attempt);

    /** Most recent first. */
    List<LoginAttempt> findRecentByUsername(String username, int limit);

    /** Most recent first, across all users. */
    List<LoginAttempt> findRecent(int limit);

    LoginStats statsSince(OffsetDateTime since);
}
