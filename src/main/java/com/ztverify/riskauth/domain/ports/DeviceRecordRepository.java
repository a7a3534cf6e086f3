package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.DeviceRecord;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface DeviceRecordRepository {

    Optional<DeviceRecord> find(String username, String deviceFingerprint);

    /**
     * Inserts a first sighting.
     *
     * @return false when a record for the same (username, fingerprint) already exists
     */
    boolean insertIfAbsent(DeviceRecord record);

    void touch(String username, String deviceFingerprint, OffsetDateTime seenAt);

    /** Most recently seen first. */
    List<DeviceRecord> findByUsername(String username);

    boolean delete(String username, String deviceFingerprint);
}
