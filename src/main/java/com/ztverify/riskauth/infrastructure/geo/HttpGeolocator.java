package com.ztverify.riskauth.infrastructure.geo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ztverify.riskauth.domain.GeoLocation;
import com.ztverify.riskauth.domain.ports.GeolocatorPort;
import com.ztverify.riskauth.domain.risk.Ipv4Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Looks up IPs against an ip-api compatible JSON endpoint ({@code {status, city, countryCode}}).
 */
@Component
@ConditionalOnProperty(name = "app.geo.enabled", havingValue = "true")
public class HttpGeolocator implements GeolocatorPort {

    private static final Logger log = LoggerFactory.getLogger(HttpGeolocator.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LookupResponse(String status, String city, String countryCode, String message) {
    }

    private final RestTemplate restTemplate;
    private final String urlTemplate;

    public HttpGeolocator(@Qualifier("geoRestTemplate") RestTemplate restTemplate,
                          @Value("${app.geo.url-template:http://ip-api.com/json/{ip}?fields=status,message,city,countryCode}") String urlTemplate) {
        this.restTemplate = restTemplate;
        this.urlTemplate = urlTemplate;
    }

    @Override
    public Optional<GeoLocation> lookup(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank() || Ipv4Range.isNonRoutable(ipAddress)) {
            return Optional.empty();
        }
        try {
            LookupResponse response = restTemplate.getForObject(urlTemplate, LookupResponse.class, ipAddress);
            if (response == null || !"success".equalsIgnoreCase(response.status())) {
                log.debug("Geolocation for {} unsuccessful: {}", ipAddress, response != null ? response.message() : "empty body");
                return Optional.empty();
            }
            return Optional.of(new GeoLocation(response.city(), response.countryCode()));
        } catch (RestClientException e) {
            log.warn("Geolocation lookup for {} failed: {}", ipAddress, e.getMessage());
            return Optional.empty();
        }
    }
}
