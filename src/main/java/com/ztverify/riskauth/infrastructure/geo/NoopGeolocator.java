package com.ztverify.riskauth.infrastructure.geo;

import com.ztverify.riskauth.domain.GeoLocation;
import com.ztverify.riskauth.domain.ports.GeolocatorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(name = "app.geo.enabled", havingValue = "false", matchIfMissing = true)
public class NoopGeolocator implements GeolocatorPort {

    @Override
    public Optional<GeoLocation> lookup(String ipAddress) {
        return Optional.empty();
    }
}
