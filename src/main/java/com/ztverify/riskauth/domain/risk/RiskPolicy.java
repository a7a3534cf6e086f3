package com.ztverify.riskauth.domain.risk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every list, window and weight the scoring engine consults. Built once at startup from
 * {@code app.risk.*}; the defaults describe a Gulf-region deployment.
 */
public final class RiskPolicy {

    /** Base scores and penalties applied by {@link RuleEngine}. */
    public record Weights(int trustedWithKnownIsp,
                          int trusted,
                          int trustedBusinessHoursBonus,
                          int botTrusted,
                          int botTrustedWithKnownIsp,
                          int regionalSafe,
                          int partner,
                          int partnerCloudPenalty,
                          int partnerBusinessHoursBonus,
                          int unrecognized,
                          int highRisk,
                          int nonRoutableIpPenalty,
                          int maliciousAsnPenalty,
                          int botPenalty,
                          int suspiciousHoursPenalty) {

        public static Weights defaults() {
            return new Weights(5, 10, 5, 70, 75, 35, 40, 10, 10, 45, 80, 25, 30, 35, 15);
        }
    }

    private final Set<String> trustedRegionCountries;
    private final Set<Integer> knownIspAsns;
    private final Set<String> regionalSafeCountries;
    private final Set<String> partnerCountries;
    private final Set<String> highRiskCountries;
    private final Set<Integer> maliciousAsns;
    private final Set<Integer> cloudAsns;
    private final List<Ipv4Range> cloudRanges;
    private final List<String> botUserAgentMarkers;
    private final HourWindow businessHours;
    private final HourWindow suspiciousHours;
    private final Map<String, HourWindow> partnerBusinessHours;
    private final Set<String> jurisdictionStepUpCountries;
    private final int jurisdictionFloor;
    private final double modelThreshold;
    private final int modelBonus;
    private final List<AccountOverride> accountOverrides;
    private final Weights weights;

    private RiskPolicy(Builder b) {
        this.trustedRegionCountries = Set.copyOf(b.trustedRegionCountries);
        this.knownIspAsns = Set.copyOf(b.knownIspAsns);
        this.regionalSafeCountries = Set.copyOf(b.regionalSafeCountries);
        this.partnerCountries = Set.copyOf(b.partnerCountries);
        this.highRiskCountries = Set.copyOf(b.highRiskCountries);
        this.maliciousAsns = Set.copyOf(b.maliciousAsns);
        this.cloudAsns = Set.copyOf(b.cloudAsns);
        this.cloudRanges = List.copyOf(b.cloudRanges);
        this.botUserAgentMarkers = List.copyOf(b.botUserAgentMarkers);
        this.businessHours = b.businessHours;
        this.suspiciousHours = b.suspiciousHours;
        this.partnerBusinessHours = Map.copyOf(b.partnerBusinessHours);
        this.jurisdictionStepUpCountries = Set.copyOf(b.jurisdictionStepUpCountries);
        this.jurisdictionFloor = RiskScores.clamp(b.jurisdictionFloor);
        this.modelThreshold = b.modelThreshold;
        this.modelBonus = b.modelBonus;
        List<AccountOverride> sorted = new ArrayList<>(b.accountOverrides);
        sorted.sort(Comparator.comparingInt(AccountOverride::priority));
        this.accountOverrides = List.copyOf(sorted);
        this.weights = b.weights;
    }

    public static RiskPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isTrustedRegion(String country) { return trustedRegionCountries.contains(country); }
    public boolean isKnownIsp(int asn) { return knownIspAsns.contains(asn); }
    public boolean isRegionalSafe(String country) { return regionalSafeCountries.contains(country); }
    public boolean isPartner(String country) { return partnerCountries.contains(country); }
    public boolean isHighRisk(String country) { return highRiskCountries.contains(country); }
    public boolean isMaliciousAsn(int asn) { return maliciousAsns.contains(asn); }

    public boolean isCloudHosted(int asn, String ip) {
        return cloudAsns.contains(asn) || cloudRanges.stream().anyMatch(r -> r.contains(ip));
    }

    public boolean isBot(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return false;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        return botUserAgentMarkers.stream().anyMatch(ua::contains);
    }

    public boolean isBusinessHour(int hour) { return businessHours.contains(hour); }
    public boolean isSuspiciousHour(int hour) { return suspiciousHours.contains(hour); }

    public Optional<HourWindow> partnerBusinessHours(String country) {
        return Optional.ofNullable(partnerBusinessHours.get(country));
    }

    public boolean requiresJurisdictionStepUp(String country) {
        return jurisdictionStepUpCountries.contains(country);
    }

    public Optional<AccountOverride> overrideFor(String username) {
        return accountOverrides.stream().filter(o -> o.username().equals(username)).findFirst();
    }

    public int getJurisdictionFloor() { return jurisdictionFloor; }
    public double getModelThreshold() { return modelThreshold; }
    public int getModelBonus() { return modelBonus; }
    public Weights getWeights() { return weights; }
    public List<AccountOverride> getAccountOverrides() { return accountOverrides; }

    public static final class Builder {
        private Collection<String> trustedRegionCountries = List.of("AE", "SA", "QA", "KW", "OM", "BH");
        private Collection<Integer> knownIspAsns = List.of(5384, 15802, 42298, 35753, 36351);
        private Collection<String> regionalSafeCountries = List.of("JO", "LB", "EG");
        private Collection<String> partnerCountries = List.of("US", "GB", "DE", "FR", "SG", "AU", "IN");
        private Collection<String> highRiskCountries = List.of("RU", "CN", "KP", "NG", "RO", "UA", "BR");
        private Collection<Integer> maliciousAsns = List.of(3280, 503109, 62350, 56851);
        private Collection<Integer> cloudAsns = List.of(16509, 14618, 15169, 8075, 14061, 396982);
        private Collection<Ipv4Range> cloudRanges = ranges(List.of("3.0.0.0/8", "13.0.0.0/8", "52.0.0.0/8", "104.0.0.0/8", "35.0.0.0/8"));
        private Collection<String> botUserAgentMarkers = List.of("python", "curl", "wget", "bot", "headless", "phantom");
        private HourWindow businessHours = new HourWindow(4, 15);
        private HourWindow suspiciousHours = new HourWindow(22, 3);
        private Map<String, HourWindow> partnerBusinessHours = Map.of("IN", new HourWindow(4, 14));
        private Collection<String> jurisdictionStepUpCountries = List.of("IN");
        private int jurisdictionFloor = 40;
        private double modelThreshold = 0.5;
        private int modelBonus = 10;
        private Collection<AccountOverride> accountOverrides = List.of();
        private Weights weights = Weights.defaults();

        private Builder() {
        }

        public Builder trustedRegionCountries(Collection<String> v) { this.trustedRegionCountries = countries(v); return this; }
        public Builder knownIspAsns(Collection<Integer> v) { this.knownIspAsns = v; return this; }
        public Builder regionalSafeCountries(Collection<String> v) { this.regionalSafeCountries = countries(v); return this; }
        public Builder partnerCountries(Collection<String> v) { this.partnerCountries = countries(v); return this; }
        public Builder highRiskCountries(Collection<String> v) { this.highRiskCountries = countries(v); return this; }
        public Builder maliciousAsns(Collection<Integer> v) { this.maliciousAsns = v; return this; }
        public Builder cloudAsns(Collection<Integer> v) { this.cloudAsns = v; return this; }
        public Builder cloudCidrs(Collection<String> v) { this.cloudRanges = ranges(v); return this; }
        public Builder businessHours(HourWindow v) { this.businessHours = v; return this; }
        public Builder suspiciousHours(HourWindow v) { this.suspiciousHours = v; return this; }
        public Builder jurisdictionStepUpCountries(Collection<String> v) { this.jurisdictionStepUpCountries = countries(v); return this; }
        public Builder jurisdictionFloor(int v) { this.jurisdictionFloor = v; return this; }
        public Builder modelThreshold(double v) { this.modelThreshold = v; return this; }
        public Builder modelBonus(int v) { this.modelBonus = v; return this; }
        public Builder accountOverrides(Collection<AccountOverride> v) { this.accountOverrides = v; return this; }
        public Builder weights(Weights v) { this.weights = v; return this; }

        public Builder botUserAgentMarkers(Collection<String> v) {
            this.botUserAgentMarkers = v.stream()
                    .map(m -> m.trim().toLowerCase(Locale.ROOT))
                    .filter(m -> !m.isEmpty())
                    .collect(Collectors.toList());
            return this;
        }

        public Builder partnerBusinessHours(Map<String, HourWindow> v) {
            Map<String, HourWindow> normalized = new LinkedHashMap<>();
            v.forEach((country, window) -> normalized.put(country.trim().toUpperCase(Locale.ROOT), window));
            this.partnerBusinessHours = normalized;
            return this;
        }

        public RiskPolicy build() {
            return new RiskPolicy(this);
        }

        private static Collection<String> countries(Collection<String> v) {
            return v.stream()
                    .map(c -> c.trim().toUpperCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        private static Collection<Ipv4Range> ranges(Collection<String> cidrs) {
            return cidrs.stream().map(Ipv4Range::parse).collect(Collectors.toList());
        }
    }
}
