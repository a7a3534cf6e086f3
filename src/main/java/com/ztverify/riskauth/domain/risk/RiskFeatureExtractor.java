package com.ztverify.riskauth.domain.risk;

import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginContext;
import com.ztverify.riskauth.domain.ports.DeviceTrustStore;
import com.ztverify.riskauth.domain.ports.LoginAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Turns a login context into {@link RiskFeatures}. The result depends only on the context and
 * what the history and device ports return.
 */
public class RiskFeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(RiskFeatureExtractor.class);

    public static final int HISTORY_LIMIT = 50;
    public static final int KNOWN_LOCATION_WINDOW = 10;
    public static final double DEFAULT_HOURS_SINCE_LAST = 24.0;
    public static final double MAX_HOURS_SINCE_LAST = 168.0;

    private final LoginAttemptRepository history;
    private final DeviceTrustStore devices;

    public RiskFeatureExtractor(LoginAttemptRepository history, DeviceTrustStore devices) {
        this.history = history;
        this.devices = devices;
    }

    public RiskFeatures extract(LoginContext ctx) {
        List<LoginAttempt> previous = loadHistory(ctx.username());
        OffsetDateTime ts = ctx.timestamp();

        double similarity = previous.isEmpty()
                ? 0.0
                : SequenceSimilarity.ratio(ctx.deviceFingerprint(), previous.get(0).getDeviceFingerprint());

        double hoursSinceLast = DEFAULT_HOURS_SINCE_LAST;
        if (!previous.isEmpty() && previous.get(0).getTimestamp() != null) {
            double hours = Duration.between(previous.get(0).getTimestamp(), ts).toMillis() / 3_600_000.0;
            hoursSinceLast = Math.min(Math.max(hours, 0.0), MAX_HOURS_SINCE_LAST);
        }

        boolean knownLocation = ctx.location() != null && previous.stream()
                .limit(KNOWN_LOCATION_WINDOW)
                .map(LoginAttempt::getLocation)
                .filter(Objects::nonNull)
                .anyMatch(ctx.location()::equals);

        return new RiskFeatures(
                ts.getHour(),
                ts.getDayOfWeek().getValue() - 1,
                similarity,
                devices.isKnown(ctx.username(), ctx.deviceFingerprint()),
                hoursSinceLast,
                knownLocation,
                ctx.countryCode(),
                ctx.deviceType(),
                ctx.asn(),
                ctx.sourceIp(),
                ctx.userAgent());
    }

    private List<LoginAttempt> loadHistory(String username) {
        try {
            return history.findRecentByUsername(username, HISTORY_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Login history unavailable for {}, scoring without it: {}", username, e.getMessage());
            return List.of();
        }
    }
}
