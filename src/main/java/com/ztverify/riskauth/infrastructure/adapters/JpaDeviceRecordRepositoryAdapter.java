package com.ztverify.riskauth.infrastructure.adapters;

import com.ztverify.riskauth.domain.DeviceRecord;
import com.ztverify.riskauth.domain.ports.DeviceRecordRepository;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import com.ztverify.riskauth.infrastructure.jpa.DeviceRecordEntity;
import com.ztverify.riskauth.infrastructure.jpa.SpringDeviceRecordRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class JpaDeviceRecordRepositoryAdapter implements DeviceRecordRepository {

    private final SpringDeviceRecordRepository devices;

    public JpaDeviceRecordRepositoryAdapter(SpringDeviceRecordRepository devices) {
        this.devices = devices;
    }

    @Override
    public Optional<DeviceRecord> find(String username, String deviceFingerprint) {
        try {
            return devices.findByUsernameAndDeviceFingerprint(username, deviceFingerprint).map(this::toDomain);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to read device record for " + username, ex);
        }
    }

    // Runs in the repository's own transaction so a unique-key violation does not poison a caller's.
    @Override
    public boolean insertIfAbsent(DeviceRecord record) {
        DeviceRecordEntity e = new DeviceRecordEntity();
        e.setUsername(record.getUsername());
        e.setDeviceFingerprint(record.getDeviceFingerprint());
        e.setFirstSeen(record.getFirstSeen());
        e.setLastSeen(record.getLastSeen());
        try {
            devices.saveAndFlush(e);
            return true;
        } catch (DataIntegrityViolationException ex) {
            return false;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to register device for " + record.getUsername(), ex);
        }
    }

    @Override
    @Transactional
    public void touch(String username, String deviceFingerprint, OffsetDateTime seenAt) {
        try {
            devices.touch(username, deviceFingerprint, seenAt);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to update device record for " + username, ex);
        }
    }

    @Override
    public List<DeviceRecord> findByUsername(String username) {
        try {
            return devices.findByUsernameOrderByLastSeenDesc(username).stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to list devices for " + username, ex);
        }
    }

    @Override
    @Transactional
    public boolean delete(String username, String deviceFingerprint) {
        try {
            return devices.deleteDevice(username, deviceFingerprint) > 0;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to remove device for " + username, ex);
        }
    }

    private DeviceRecord toDomain(DeviceRecordEntity e) {
        return new DeviceRecord(e.getUsername(), e.getDeviceFingerprint(), e.getFirstSeen(), e.getLastSeen());
    }
}
