package com.ztverify.riskauth.infrastructure.adapters;

import com.ztverify.riskauth.domain.Decision;
import com.ztverify.riskauth.domain.DeviceRecord;
import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginStats;
import com.ztverify.riskauth.domain.otp.OtpChallenge;
import com.ztverify.riskauth.domain.ports.DeviceRecordRepository;
import com.ztverify.riskauth.domain.ports.LoginAttemptRepository;
import com.ztverify.riskauth.domain.ports.OtpChallengeRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaAdaptersIntegrationTest {

    private static final OffsetDateTime NOW = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private LoginAttemptRepository attempts;

    @Autowired
    private DeviceRecordRepository devices;

    @Autowired
    private OtpChallengeRepository challenges;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void shouldRoundTripAuditEntriesNewestFirst() {
        String user = unique("audit");
        attempts.append(new LoginAttempt(null, user, NOW.minusMinutes(5), "94.200.1.1", "fp", "Dubai, AE",
                0.05, Decision.ALLOW, true, "LOW_RISK", List.of("Trusted regional ISP (AE, AS5384)")));
        attempts.append(new LoginAttempt(null, user, NOW, "95.31.1.1", "fp2", null,
                null, Decision.DENY, false, "WRONG_SECRET", List.of()));

        List<LoginAttempt> recent = attempts.findRecentByUsername(user, 10);

        assertThat(recent).extracting(LoginAttempt::getDecision).containsExactly(Decision.DENY, Decision.ALLOW);
        assertThat(recent.get(0).getRiskScore()).isNull();
        assertThat(recent.get(1).getRiskFactors()).containsExactly("Trusted regional ISP (AE, AS5384)");
        assertThat(attempts.findRecentByUsername(user, 1)).hasSize(1);

        LoginStats stats = attempts.statsSince(NOW.minusMinutes(10));
        assertThat(stats.count(Decision.DENY)).isGreaterThanOrEqualTo(1);
        assertThat(stats.total()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void shouldRejectDuplicateDeviceInsert() {
        String user = unique("device");
        DeviceRecord first = DeviceRecord.firstSighting(user, "fp-1", NOW);

        assertThat(devices.insertIfAbsent(first)).isTrue();
        assertThat(devices.insertIfAbsent(DeviceRecord.firstSighting(user, "fp-1", NOW.plusMinutes(1)))).isFalse();

        devices.touch(user, "fp-1", NOW.plusHours(1));
        devices.touch(user, "fp-1", NOW.plusMinutes(30));

        DeviceRecord stored = devices.find(user, "fp-1").orElseThrow();
        assertThat(stored.getLastSeen().toInstant()).isEqualTo(NOW.plusHours(1).toInstant());
        assertThat(stored.getFirstSeen().toInstant()).isEqualTo(NOW.toInstant());
        assertThat(devices.delete(user, "fp-1")).isTrue();
        assertThat(devices.find(user, "fp-1")).isEmpty();
    }

    @Test
    void shouldEnforceAttemptCapAndSingleVerificationInStorage() {
        String user = unique("otp");
        OtpChallenge c = challenges.save(OtpChallenge.issue(user, "a".repeat(64), NOW, Duration.ofMinutes(5)));

        assertThat(challenges.incrementAttempts(c.getId(), 2)).isTrue();
        assertThat(challenges.incrementAttempts(c.getId(), 2)).isTrue();
        assertThat(challenges.incrementAttempts(c.getId(), 2)).isFalse();
        assertThat(challenges.markVerified(c.getId(), 2, NOW)).isFalse();
        assertThat(challenges.findLatest(user).orElseThrow().getAttempts()).isEqualTo(2);

        OtpChallenge fresh = challenges.save(OtpChallenge.issue(user, "b".repeat(64), NOW.plusSeconds(1), Duration.ofMinutes(5)));
        assertThat(challenges.findLatest(user).orElseThrow().getId()).isEqualTo(fresh.getId());
        assertThat(challenges.markVerified(fresh.getId(), 3, NOW.plusMinutes(10))).isFalse();
        assertThat(challenges.markVerified(fresh.getId(), 3, NOW.plusMinutes(1))).isTrue();
        assertThat(challenges.markVerified(fresh.getId(), 3, NOW.plusMinutes(1))).isFalse();
    }

    @Test
    void shouldInvalidateOnlyOpenChallenges() {
        String user = unique("inval");
        OtpChallenge verified = challenges.save(OtpChallenge.issue(user, "c".repeat(64), NOW, Duration.ofMinutes(5)));
        challenges.markVerified(verified.getId(), 3, NOW);
        OtpChallenge open = challenges.save(OtpChallenge.issue(user, "d".repeat(64), NOW.plusSeconds(1), Duration.ofMinutes(5)));

        assertThat(challenges.invalidateOpen(user)).isEqualTo(1);
        assertThat(challenges.findLatest(user).orElseThrow().isInvalidated()).isTrue();

        challenges.delete(open.getId());
        assertThat(challenges.findLatest(user).orElseThrow().getId()).isEqualTo(verified.getId());
    }
}
