package com.ztverify.riskauth.domain.risk;

/**
 * Features derived from a login context and the user's history.
 * {@link #vector()} exposes the numeric part in the fixed order the anomaly model was trained on.
 */
public record RiskFeatures(int hourOfDay,
                           int dayOfWeek,
                           double deviceSimilarity,
                           boolean knownDevice,
                           double hoursSinceLastAttempt,
                           boolean knownLocation,
                           String countryCode,
                           String deviceType,
                           int asn,
                           String sourceIp,
                           String userAgent) {

    public static final String[] VECTOR_NAMES = {
            "hourOfDay", "dayOfWeek", "deviceSimilarity", "knownDevice", "hoursSinceLastAttempt", "knownLocation"
    };

    public double[] vector() {
        return new double[] {
                hourOfDay,
                dayOfWeek,
                deviceSimilarity,
                knownDevice ? 1.0 : 0.0,
                hoursSinceLastAttempt,
                knownLocation ? 1.0 : 0.0
        };
    }
}
