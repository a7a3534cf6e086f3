package com.ztverify.riskauth.application;

import java.time.OffsetDateTime;

public class AuthenticateCommand {
    public final String username;
    public final String secret;
    public final OffsetDateTime timestamp;
    public final String sourceIp;
    public final String userAgent;
    public final String deviceFingerprint;
    public final Integer asn;
    public final String countryCode;
    public final String location;
    public final String deviceType;

    public AuthenticateCommand(String username, String secret, OffsetDateTime timestamp, String sourceIp,
                               String userAgent, String deviceFingerprint, Integer asn,
                               String countryCode, String location, String deviceType) {
        this.username = username;
        this.secret = secret;
        this.timestamp = timestamp;
        this.sourceIp = sourceIp;
        this.userAgent = userAgent;
        this.deviceFingerprint = deviceFingerprint;
        this.asn = asn;
        this.countryCode = countryCode;
        this.location = location;
        this.deviceType = deviceType;
    }
}
