package com.ztverify.riskauth.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "user_devices",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_devices_username_fingerprint",
                columnNames = {"username", "device_fingerprint"}))
public class DeviceRecordEntity {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(nullable = false, length = 150)
    private String username;

    @Column(name = "device_fingerprint", nullable = false, length = 512)
    private String deviceFingerprint;

    @Column(name = "first_seen", nullable = false)
    private OffsetDateTime firstSeen;

    @Column(name = "last_seen", nullable = false)
    private OffsetDateTime lastSeen;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getDeviceFingerprint() { return deviceFingerprint; }
    public void setDeviceFingerprint(String deviceFingerprint) { this.deviceFingerprint = deviceFingerprint; }

    public OffsetDateTime getFirstSeen() { return firstSeen; }
    public void setFirstSeen(OffsetDateTime firstSeen) { this.firstSeen = firstSeen; }

    public OffsetDateTime getLastSeen() { return lastSeen; }
    public void setLastSeen(OffsetDateTime lastSeen) { this.lastSeen = lastSeen; }
}
