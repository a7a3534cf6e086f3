package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.DeviceRecord;
import com.ztverify.riskauth.domain.ports.DeviceRecordRepository;
import com.ztverify.riskauth.domain.ports.DeviceTrustStore;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class DeviceTrustService implements DeviceTrustStore {

    private static final Logger log = LoggerFactory.getLogger(DeviceTrustService.class);

    private final DeviceRecordRepository devices;
    private final UserLockRegistry locks;
    private final Clock clock;

    public DeviceTrustService(DeviceRecordRepository devices, UserLockRegistry locks, Clock clock) {
        this.devices = devices;
        this.locks = locks;
        this.clock = clock;
    }

    @Override
    public boolean isKnown(String username, String deviceFingerprint) {
        if (deviceFingerprint == null || deviceFingerprint.isBlank()) {
            return false;
        }
        try {
            return devices.find(username, deviceFingerprint).isPresent();
        } catch (RuntimeException e) {
            log.warn("Device lookup failed for {}, treating device as unknown: {}", username, e.getMessage());
            return false;
        }
    }

    @Override
    public DeviceRecord registerOrTouch(String username, String deviceFingerprint) {
        if (deviceFingerprint == null || deviceFingerprint.isBlank()) {
            throw new IllegalArgumentException("device fingerprint is required");
        }
        return locks.withUserLock(username, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            DeviceRecord existing = devices.find(username, deviceFingerprint).orElse(null);
            if (existing == null) {
                DeviceRecord created = DeviceRecord.firstSighting(username, deviceFingerprint, now);
                if (devices.insertIfAbsent(created)) {
                    log.info("New trusted device registered for {}", username);
                    return created;
                }
                // Another node registered it first.
                existing = devices.find(username, deviceFingerprint)
                        .orElseThrow(() -> new StorageUnavailableException(
                                "Device record for " + username + " vanished after a duplicate insert"));
            }
            devices.touch(username, deviceFingerprint, now);
            return existing.touchedAt(now);
        });
    }

    public List<DeviceRecord> listDevices(String username) {
        return devices.findByUsername(username);
    }

    public boolean removeDevice(String username, String deviceFingerprint) {
        boolean removed = locks.withUserLock(username, () -> devices.delete(username, deviceFingerprint));
        if (removed) {
            log.info("Trusted device removed for {}", username);
        }
        return removed;
    }
}
