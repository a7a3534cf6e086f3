package com.ztverify.riskauth.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Raw signals describing one login, after credential verification and geolocation.
 * The country code is normalised to upper case, {@code XX} when unknown, and the timestamp to UTC.
 */
public record LoginContext(String username,
                           OffsetDateTime timestamp,
                           String sourceIp,
                           String countryCode,
                           int asn,
                           String userAgent,
                           String deviceFingerprint,
                           String location,
                           String deviceType) {

    public static final String UNKNOWN_COUNTRY = "XX";

    public LoginContext {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        timestamp = timestamp.withOffsetSameInstant(ZoneOffset.UTC);
        countryCode = (countryCode == null || countryCode.isBlank())
                ? UNKNOWN_COUNTRY
                : countryCode.trim().toUpperCase();
        userAgent = userAgent == null ? "" : userAgent;
        deviceFingerprint = deviceFingerprint == null ? "" : deviceFingerprint;
        deviceType = (deviceType == null || deviceType.isBlank()) ? "unknown" : deviceType.trim().toLowerCase();
    }
}
