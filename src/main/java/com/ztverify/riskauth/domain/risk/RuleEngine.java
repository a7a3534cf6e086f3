package com.ztverify.riskauth.domain.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic login risk rules. The first matching origin rule picks the base score,
 * then penalties are added and the total clamped to [0, 100].
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    public static class Result {
        private final List<String> factors = new ArrayList<>();
        private int score = 0;

        void base(int value, String factor) {
            score = value;
            factors.add(factor);
        }

        void add(int delta, String factor) {
            score += delta;
            factors.add(factor);
            log.debug("Risk factor '{}' ({}{}, total: {})", factor, delta >= 0 ? "+" : "", delta, score);
        }

        void floor(int min, String factor) {
            if (score < min) {
                log.debug("Risk floor '{}' raised score {} to {}", factor, score, min);
                score = min;
                factors.add(factor);
            }
        }

        public int getScore() { return RiskScores.clamp(score); }
        public List<String> getFactors() { return List.copyOf(factors); }
        public RiskLevel getLevel() { return RiskLevel.fromScore(getScore()); }
    }

    private final RiskPolicy policy;

    public RuleEngine(RiskPolicy policy) {
        this.policy = policy;
    }

    public Result evaluate(RiskFeatures f) {
        RiskPolicy.Weights w = policy.getWeights();
        Result r = new Result();
        String country = f.countryCode();
        boolean trusted = policy.isTrustedRegion(country);
        boolean knownIsp = policy.isKnownIsp(f.asn());
        boolean bot = policy.isBot(f.userAgent());

        if (trusted && bot) {
            if (knownIsp) {
                r.base(w.botTrustedWithKnownIsp(), "Automated client on trusted regional ISP (" + country + ", AS" + f.asn() + ")");
            } else {
                r.base(w.botTrusted(), "Automated client from trusted region (" + country + ")");
            }
            log.info("Bot user agent from trusted region {} short-circuited scoring at {}", country, r.getScore());
            return r;
        }

        if (trusted) {
            evaluateTrustedRegion(f, knownIsp, w, r);
        } else {
            evaluateOrigin(f, w, r);
        }
        evaluatePenalties(f, trusted, bot, w, r);
        if (bot) {
            // Automated clients are high risk whatever the origin scored.
            r.floor(w.botTrusted(), "Automated client floor");
        }

        log.debug("Rule evaluation for country {} finished with score {} ({})", country, r.getScore(), r.getLevel());
        return r;
    }

    private void evaluateTrustedRegion(RiskFeatures f, boolean knownIsp, RiskPolicy.Weights w, Result r) {
        if (knownIsp) {
            r.base(w.trustedWithKnownIsp(), "Trusted regional ISP (" + f.countryCode() + ", AS" + f.asn() + ")");
            return;
        }
        r.base(w.trusted(), "Trusted region (" + f.countryCode() + ")");
        if (policy.isBusinessHour(f.hourOfDay())) {
            r.add(-w.trustedBusinessHoursBonus(), "Regional business hours");
        }
    }

    private void evaluateOrigin(RiskFeatures f, RiskPolicy.Weights w, Result r) {
        String country = f.countryCode();
        if (policy.isHighRisk(country)) {
            r.base(w.highRisk(), "High-risk country (" + country + ")");
        } else if (policy.isRegionalSafe(country)) {
            r.base(w.regionalSafe(), "Regional neighbour (" + country + ")");
        } else if (policy.isPartner(country)) {
            r.base(w.partner(), "Partner country (" + country + ")");
            if (policy.isCloudHosted(f.asn(), f.sourceIp())) {
                r.add(w.partnerCloudPenalty(), "Cloud or hosting network");
            }
            policy.partnerBusinessHours(country)
                    .filter(window -> window.contains(f.hourOfDay()))
                    .ifPresent(window -> r.add(-w.partnerBusinessHoursBonus(), "Local business hours (" + country + ")"));
        } else {
            r.base(w.unrecognized(), "Unrecognized location (" + country + ")");
        }
    }

    private void evaluatePenalties(RiskFeatures f, boolean trusted, boolean bot, RiskPolicy.Weights w, Result r) {
        if (Ipv4Range.isNonRoutable(f.sourceIp())) {
            r.add(w.nonRoutableIpPenalty(), "Private or non-routable source address");
        }
        if (policy.isMaliciousAsn(f.asn())) {
            r.add(w.maliciousAsnPenalty(), "Known malicious network (AS" + f.asn() + ")");
        }
        if (bot) {
            r.add(w.botPenalty(), "Automated user agent");
        }
        if (trusted && policy.isSuspiciousHour(f.hourOfDay())) {
            r.add(w.suspiciousHoursPenalty(), "Login at unusual hour (" + f.hourOfDay() + ":00 UTC)");
        }
    }
}
