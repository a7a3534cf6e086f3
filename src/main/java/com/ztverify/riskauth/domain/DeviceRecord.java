package com.ztverify.riskauth.domain;

import java.time.OffsetDateTime;

public class DeviceRecord {

    private final String username;
    private final String deviceFingerprint;
    private final OffsetDateTime firstSeen;
    private final OffsetDateTime lastSeen;

    public DeviceRecord(String username, String deviceFingerprint, OffsetDateTime firstSeen, OffsetDateTime lastSeen) {
        if (lastSeen.isBefore(firstSeen)) {
            throw new IllegalArgumentException("lastSeen " + lastSeen + " precedes firstSeen " + firstSeen);
        }
        this.username = username;
        this.deviceFingerprint = deviceFingerprint;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
    }

    public static DeviceRecord firstSighting(String username, String deviceFingerprint, OffsetDateTime now) {
        return new DeviceRecord(username, deviceFingerprint, now, now);
    }

    public DeviceRecord touchedAt(OffsetDateTime seenAt) {
        return new DeviceRecord(username, deviceFingerprint, firstSeen,
                seenAt.isAfter(lastSeen) ? seenAt : lastSeen);
    }

    public String getUsername() {
        return username;
    }

    public String getDeviceFingerprint() {
        return deviceFingerprint;
    }

    public OffsetDateTime getFirstSeen() {
        return firstSeen;
    }

    public OffsetDateTime getLastSeen() {
        return lastSeen;
    }
}
