package com.ztverify.riskauth.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "login_attempts")
public class LoginAttemptEntity {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(nullable = false, length = 150)
    private String username;

    @Column(name = "attempted_at", nullable = false)
    private OffsetDateTime attemptedAt;

    @Column(name = "source_ip", length = 64)
    private String sourceIp;

    @Column(name = "device_fingerprint", length = 512)
    private String deviceFingerprint;

    @Column(length = 150)
    private String location;

    // 0.0-1.0
    @Column(name = "risk_score")
    private Double riskScore;

    @Column(nullable = false, length = 16)
    private String decision;

    @Column(nullable = false)
    private boolean succeeded;

    @Column(length = 64)
    private String reason;

    @Column(name = "risk_factors", columnDefinition = "TEXT")
    private String riskFactors;

    public LoginAttemptEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public OffsetDateTime getAttemptedAt() { return attemptedAt; }
    public void setAttemptedAt(OffsetDateTime attemptedAt) { this.attemptedAt = attemptedAt; }

    public String getSourceIp() { return sourceIp; }
    public void setSourceIp(String sourceIp) { this.sourceIp = sourceIp; }

    public String getDeviceFingerprint() { return deviceFingerprint; }
    public void setDeviceFingerprint(String deviceFingerprint) { this.deviceFingerprint = deviceFingerprint; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public Double getRiskScore() { return riskScore; }
    public void setRiskScore(Double riskScore) { this.riskScore = riskScore; }

    public String getDecision() { return decision; }
    public void setDecision(String decision) { this.decision = decision; }

    public boolean isSucceeded() { return succeeded; }
    public void setSucceeded(boolean succeeded) { this.succeeded = succeeded; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getRiskFactors() { return riskFactors; }
    public void setRiskFactors(String riskFactors) { this.riskFactors = riskFactors; }
}
