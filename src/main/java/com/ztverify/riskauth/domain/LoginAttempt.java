package com.ztverify.riskauth.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit record of a single authentication attempt.
 * The risk score is kept on the external 0.0-1.0 scale and is null for attempts that
 * never reached scoring (credential failures).
 */
public class LoginAttempt {

    private final UUID id;
    private final String username;
    private final OffsetDateTime timestamp;
    private final String sourceIp;
    private final String deviceFingerprint;
    private final String location;
    private final Double riskScore;
    private final Decision decision;
    private final boolean succeeded;
    private final String reason;
    private final List<String> riskFactors;

    public LoginAttempt(UUID id, String username, OffsetDateTime timestamp, String sourceIp,
                        String deviceFingerprint, String location, Double riskScore,
                        Decision decision, boolean succeeded, String reason, List<String> riskFactors) {
        if (riskScore != null && (riskScore < 0.0 || riskScore > 1.0)) {
            throw new IllegalArgumentException("riskScore must be within [0.0, 1.0]: " + riskScore);
        }
        this.id = id != null ? id : UUID.randomUUID();
        this.username = username;
        this.timestamp = timestamp;
        this.sourceIp = sourceIp;
        this.deviceFingerprint = deviceFingerprint;
        this.location = location;
        this.riskScore = riskScore;
        this.decision = decision;
        this.succeeded = succeeded;
        this.reason = reason;
        this.riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public String getDeviceFingerprint() {
        return deviceFingerprint;
    }

    public String getLocation() {
        return location;
    }

    public Double getRiskScore() {
        return riskScore;
    }

    public Decision getDecision() {
        return decision;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public String getReason() {
        return reason;
    }

    public List<String> getRiskFactors() {
        return riskFactors;
    }
}
