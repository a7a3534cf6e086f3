package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.GeoLocation;

import java.util.Optional;

public interface GeolocatorPort {

    Optional<GeoLocation> lookup(String ipAddress);
}
