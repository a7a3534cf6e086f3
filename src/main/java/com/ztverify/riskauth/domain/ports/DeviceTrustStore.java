package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.DeviceRecord;

/**
 * Devices a user has previously completed an allowed login from.
 */
public interface DeviceTrustStore {

    /** Unknown when the store cannot be read. */
    boolean isKnown(String username, String deviceFingerprint);

    DeviceRecord registerOrTouch(String username, String deviceFingerprint);
}
