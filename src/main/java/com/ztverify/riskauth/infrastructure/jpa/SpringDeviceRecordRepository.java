package com.ztverify.riskauth.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringDeviceRecordRepository extends JpaRepository<DeviceRecordEntity, UUID> {

    Optional<DeviceRecordEntity> findByUsernameAndDeviceFingerprint(String username, String deviceFingerprint);

    boolean existsByUsernameAndDeviceFingerprint(String username, String deviceFingerprint);

    List<DeviceRecordEntity> findByUsernameOrderByLastSeenDesc(String username);

    // Never moves lastSeen backwards.
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeviceRecordEntity d SET d.lastSeen = :seenAt WHERE d.username = :username AND d.deviceFingerprint = :fingerprint AND d.lastSeen < :seenAt")
    int touch(@Param("username") String username, @Param("fingerprint") String fingerprint, @Param("seenAt") OffsetDateTime seenAt);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM DeviceRecordEntity d WHERE d.username = :username AND d.deviceFingerprint = :fingerprint")
    int deleteDevice(@Param("username") String username, @Param("fingerprint") String fingerprint);
}
